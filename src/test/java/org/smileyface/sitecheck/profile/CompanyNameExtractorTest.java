package org.smileyface.sitecheck.profile;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.smileyface.sitecheck.model.PageSignal;

import static org.assertj.core.api.Assertions.*;

class CompanyNameExtractorTest {

    private final CompanyNameExtractor extractor = new CompanyNameExtractor(new ObjectMapper());

    private static String ld(String json) {
        return "<script type=\"application/ld+json\">" + json + "</script>";
    }

    private static PageSignal.Builder page(String html) {
        return PageSignal.builder("https://www.example.co.jp/").html(html);
    }

    @Test
    void organizationNameFromStructuredData() {
        String html = ld("{\"@type\":\"WebSite\",\"name\":\"サイト名\"}")
                + ld("{\"@type\":\"LocalBusiness\",\"name\":\"山田工務店\"}");
        assertThat(extractor.extract(page(html).title("トップ | 何か").build())).isEqualTo("山田工務店");
    }

    @Test
    void providerNameFromStructuredData() {
        String html = ld("{\"@type\":\"Service\",\"provider\":{\"@type\":\"Organization\",\"name\":\"株式会社プロバイダ\"}}");
        assertThat(extractor.extract(page(html).build())).isEqualTo("株式会社プロバイダ");
    }

    @Test
    void anyShortStructuredDataNameOnSecondPass() {
        String html = ld("{broken") + ld("{\"@type\":\"WebSite\",\"name\":\"サンプルサイト\"}");
        assertThat(extractor.extract(page(html).build())).isEqualTo("サンプルサイト");
    }

    @Test
    void titlePartWithLegalEntityKeyword() {
        PageSignal p = page("").title("ホーム | 株式会社サンプル | 東京の会計事務所").build();
        assertThat(extractor.extract(p)).isEqualTo("株式会社サンプル");
    }

    @Test
    void lastTitlePartWhenNoKeyword() {
        PageSignal p = page("").title("採用情報 － サンプル商店").build();
        assertThat(extractor.extract(p)).isEqualTo("サンプル商店");
    }

    @Test
    void legalEntityTokenInText() {
        PageSignal p = page("").title("ようこそ").textContent("運営会社 サンプル株式会社 について").build();
        assertThat(extractor.extract(p)).isEqualTo("サンプル株式会社");
    }

    @Test
    void titleThenHost() {
        assertThat(extractor.extract(page("").title("ようこそ").build())).isEqualTo("ようこそ");
        assertThat(extractor.extract(page("").build())).isEqualTo("www.example.co.jp");
    }
}
