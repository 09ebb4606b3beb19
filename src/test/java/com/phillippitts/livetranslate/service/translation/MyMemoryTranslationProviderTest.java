package com.phillippitts.livetranslate.service.translation;

import com.phillippitts.livetranslate.exception.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MyMemoryTranslationProviderTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private MyMemoryTranslationProvider provider;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new MyMemoryTranslationProvider(restTemplate, "http://mymemory.test");
    }

    @Test
    void translatesUsingBaseLanguagePair() {
        server.expect(requestTo(startsWith("http://mymemory.test/get?q=Hello")))
                .andExpect(requestTo(containsString("langpair=en%7Ces")))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"responseStatus\":200,\"responseData\":{\"translatedText\":\"Hola\"}}",
                        MediaType.APPLICATION_JSON));

        assertThat(provider.translate("Hello", "en-US", "es-MX")).isEqualTo("Hola");
        server.verify();
    }

    @Test
    void wrapsHttpFailure() {
        server.expect(requestTo(startsWith("http://mymemory.test/get"))).andRespond(withServerError());

        assertThatThrownBy(() -> provider.translate("Hello", "en", "fr"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("MyMemory request failed")
                .hasMessageContaining("(provider: mymemory)");
    }

    @Test
    void rejectsLogicalErrorStatus() {
        assertThatThrownBy(() -> provider.parse(
                "{\"responseStatus\":403,\"responseDetails\":\"INVALID LANGUAGE PAIR\"}", "xx"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("status 403")
                .hasMessageContaining("INVALID LANGUAGE PAIR");
    }

    @Test
    void rejectsMissingTranslation() {
        assertThatThrownBy(() -> provider.parse("{\"responseStatus\":200,\"responseData\":{}}", "de"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("no translation for de");
    }

    @Test
    void rejectsMalformedBody() {
        assertThatThrownBy(() -> provider.parse("<html>", "de"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("malformed JSON");
        assertThatThrownBy(() -> provider.parse("", "de"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("empty body");
    }
}
