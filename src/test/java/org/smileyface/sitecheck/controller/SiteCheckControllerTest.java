package org.smileyface.sitecheck.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SiteCheckControllerTest {

    @Autowired
    private MockMvc mvc;

    private ResultActions postJson(String body) throws Exception {
        return mvc.perform(post("/api/site-check").contentType(MediaType.APPLICATION_JSON).content(body));
    }

    @Test
    void check_selfHostedSite() throws Exception {
        postJson("{\"url\":\"sitecheck.test\",\"strategy\":\"targeted\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.crawl.success").value(true))
                .andExpect(jsonPath("$.crawl.finalUrl").value("https://sitecheck.test"))
                .andExpect(jsonPath("$.crawl.isHttps").value(true))
                .andExpect(jsonPath("$.crawl.pages[0].type").value("other"))
                .andExpect(jsonPath("$.crawl.pageStatuses[0].label").value("トップページ"))
                .andExpect(jsonPath("$.crawl.pageStatuses[0].status").value("success"))
                .andExpect(jsonPath("$.crawl.error").doesNotExist())
                .andExpect(jsonPath("$.score.categories.technical.details.security.score").value(5))
                .andExpect(jsonPath("$.score.categories.content.maxScore").value(25))
                .andExpect(jsonPath("$.score.totalScore").isNumber());
    }

    @Test
    void check_missingUrl() throws Exception {
        postJson("{\"strategy\":\"broad\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(SiteCheckController.MISSING_URL_MESSAGE));
    }

    @Test
    void check_invalidUrl() throws Exception {
        postJson("{\"url\":\"exa mple\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("URLの形式が正しくありません。例：https://example.com"));
    }

    @Test
    void check_unknownStrategy() throws Exception {
        postJson("{\"url\":\"sitecheck.test\",\"strategy\":\"deep\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Unknown crawl strategy: deep"));
    }
}
