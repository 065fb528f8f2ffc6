package com.wom.openings.source.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wom.openings.config.OpeningsProperties;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpecificationDiscoveryTest {

    private final ObjectMapper om = new ObjectMapper();
    private final SpecificationDiscovery discovery =
            new SpecificationDiscovery(RestClient.create(), om, new OpeningsProperties().getRegistry());
    private final URI specUri = URI.create("https://docs.test/api/swagger.json");

    @Test
    void extractsEitherLinkStyle() {
        assertThat(SpecificationDiscovery.extractSpecUrl("const ui = SwaggerUIBundle({url: 'v1/api.json'})"))
                .contains("v1/api.json");
        assertThat(SpecificationDiscovery.extractSpecUrl("""
                {"urls": [ {"name": "bis", "url": "https://api.test/bis.json"} ]}
                """)).contains("https://api.test/bis.json");
        assertThat(SpecificationDiscovery.extractSpecUrl("<html>nothing here</html>")).isEmpty();
        assertThat(SpecificationDiscovery.extractSpecUrl(null)).isEmpty();
    }

    @Test
    void swaggerTwoBaseUrl() throws Exception {
        JsonNode spec = om.readTree("""
                {"swagger":"2.0","host":"avoindata.test","basePath":"/bis/v1","schemes":["https"],
                 "paths":{"":{"get":{"parameters":[
                   {"name":"companyRegistrationFrom"},{"name":"companyRegistrationTo"}]}}}}
                """);

        EndpointDescriptor d = discovery.fromSpecification(spec, specUri);

        assertThat(d.baseUrl()).isEqualTo("https://avoindata.test/bis/v1");
        assertThat(d.searchPath()).isEmpty();
        assertThat(d.detailPath()).isEqualTo("/{businessId}");
    }

    @Test
    void pathLevelParametersCount() throws Exception {
        JsonNode spec = om.readTree("""
                {"paths":{
                   "/search":{"parameters":[{"name":"companyRegistrationFrom"}],
                              "post":{"parameters":[{"name":"companyRegistrationTo"}]}},
                   "/entity/{id}":{}}}
                """);

        EndpointDescriptor d = discovery.fromSpecification(spec, specUri);

        assertThat(d.baseUrl()).isEqualTo("https://docs.test");
        assertThat(d.searchPath()).isEqualTo("/search");
        assertThat(d.detailPath()).isEqualTo("/entity/{id}");
    }

    @Test
    void relativeServerUrlResolvesAgainstDescription() {
        ObjectNode spec = om.createObjectNode();
        spec.putArray("servers").addObject().put("url", "/opendata-api/v3");

        assertThat(SpecificationDiscovery.baseUrl(spec, specUri)).isEqualTo("https://docs.test/opendata-api/v3");
    }

    @Test
    void noMatchingOperation() throws Exception {
        JsonNode spec = om.readTree("""
                {"paths":{"/companies":{"get":{"parameters":[{"name":"name"}]}}}}
                """);

        assertThatThrownBy(() -> discovery.fromSpecification(spec, specUri))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("companyRegistrationFrom");
    }
}
