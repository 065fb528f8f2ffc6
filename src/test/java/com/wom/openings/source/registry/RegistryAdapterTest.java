package com.wom.openings.source.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.wom.openings.TestContexts;
import com.wom.openings.config.OpeningsProperties;
import com.wom.openings.exception.EndpointResolutionException;
import com.wom.openings.model.CanonicalRecord;
import com.wom.openings.model.QueryContext;
import com.wom.openings.model.RawPayload;
import com.wom.openings.normalize.CanonicalRecordNormalizer;
import com.wom.openings.normalize.OpeningDateParser;
import com.wom.openings.service.ConfidenceScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RegistryAdapterTest {

    private static final String BASE = "https://reg.test/bis/v1";
    private static final EndpointDescriptor ENDPOINT = new EndpointDescriptor(BASE, "", null);

    private final OpeningsProperties props = new OpeningsProperties();
    private EndpointResolver resolver;
    private MockRestServiceServer server;
    private RegistryAdapter adapter;

    @BeforeEach
    void setUp() {
        resolver = mock(EndpointResolver.class);
        when(resolver.resolve(any())).thenReturn(ENDPOINT);
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        adapter = new RegistryAdapter(builder.build(), resolver, props);
    }

    private static String hits(String... ids) {
        StringBuilder sb = new StringBuilder("{\"results\":[");
        for (int i = 0; i < ids.length; i++) {
            if (i > 0) sb.append(',');
            sb.append("{\"businessId\":\"").append(ids[i]).append("\",\"name\":\"Company ").append(ids[i])
                    .append("\",\"registrationDate\":\"2025-05-01\"}");
        }
        return sb.append("]}").toString();
    }

    private void expectSearch(String resultsFrom, String body) {
        server.expect(requestTo(startsWith(BASE + "?")))
                .andExpect(queryParam("resultsFrom", resultsFrom))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
    }

    private void expectDetail(String id, String body) {
        server.expect(requestTo(BASE + "/" + id)).andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
    }

    @Nested
    @DisplayName("Detail lookup")
    class Detail {

        @Test
        @DisplayName("a failed lookup still yields the record, without address or business line")
        void networkFailure() {
            server.expect(requestTo(startsWith(BASE + "?"))).andRespond(withSuccess("""
                    {"results":[{"businessId":"1234567-8","name":"Foo Oy","registrationDate":"2025-05-20"}]}
                    """, MediaType.APPLICATION_JSON));
            server.expect(requestTo(BASE + "/1234567-8")).andRespond(request -> {
                throw new IOException("connection reset");
            });
            QueryContext ctx = TestContexts.helsinki().registry().build();

            List<RawPayload> payloads = adapter.fetch(ctx);

            server.verify();
            assertThat(payloads).hasSize(1);
            assertThat(payloads.get(0).body().has("detail")).isFalse();

            CanonicalRecord r = new CanonicalRecordNormalizer(new OpeningDateParser(), new ConfidenceScorer(), props)
                    .normalize(payloads.get(0), ctx).orElseThrow();
            assertThat(r.name()).isEqualTo("Foo Oy");
            assertThat(r.address()).isEmpty();
            assertThat(r.tags()).noneMatch(t -> t.startsWith("business_line:"));
        }

        @Test
        void unwrapsResultsOrAcceptsBareObject() {
            expectDetail("1", "{\"results\":[{\"addresses\":[]}]}");
            expectDetail("2", "{\"businessLines\":[{\"code\":\"56101\"}]}");
            expectDetail("3", "{\"results\":[]}");
            expectDetail("4", "[1,2]");

            assertThat(adapter.lookupDetail(ENDPOINT, "1")).isNotNull();
            JsonNode bare = adapter.lookupDetail(ENDPOINT, "2");
            assertThat(bare.path("businessLines").isArray()).isTrue();
            assertThat(adapter.lookupDetail(ENDPOINT, "3")).isNull();
            assertThat(adapter.lookupDetail(ENDPOINT, "4")).isNull();
            assertThat(adapter.lookupDetail(ENDPOINT, " ")).isNull();
            server.verify();
        }
    }

    @Nested
    @DisplayName("Paging")
    class Paging {

        @Test
        @DisplayName("advances by the batch size and stops on a short page")
        void stopsOnShortPage() {
            QueryContext ctx = TestContexts.helsinki().registry().pageSize(2).build();
            expectSearch("0", hits("A", "B"));
            expectDetail("A", "{}");
            expectDetail("B", "{}");
            expectSearch("2", hits("C"));
            expectDetail("C", "{}");

            List<RawPayload> payloads = adapter.fetch(ctx);

            server.verify();
            assertThat(payloads).extracting(p -> p.body().path("company").path("businessId").asText())
                    .containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("the result cap spans every business-line code")
        void capAcrossCodes() {
            QueryContext ctx = TestContexts.helsinki().registry().codes("56101", "56102").pageSize(2).maxResults(3).build();
            server.expect(requestTo(startsWith(BASE + "?")))
                    .andExpect(queryParam("businessLineCode", "56101"))
                    .andRespond(withSuccess(hits("A", "B"), MediaType.APPLICATION_JSON));
            expectDetail("A", "{}");
            expectDetail("B", "{}");
            expectSearch("2", hits("C", "D"));
            expectDetail("C", "{}");

            List<RawPayload> payloads = adapter.fetch(ctx);

            server.verify();
            assertThat(payloads).hasSize(3);
            assertThat(payloads).allMatch(p -> p.body().path("businessLineCode").asText().equals("56101"));
        }

        @Test
        @DisplayName("a failing page keeps what earlier pages returned")
        void pageErrorKeepsEarlierPages() {
            QueryContext ctx = TestContexts.helsinki().registry().pageSize(1).build();
            expectSearch("0", hits("A"));
            expectDetail("A", "{}");
            server.expect(requestTo(startsWith(BASE + "?"))).andRespond(withServerError());

            assertThat(adapter.fetch(ctx)).hasSize(1);
            server.verify();
        }

        @Test
        void missingResultsArrayStops() {
            expectSearch("0", "{\"message\":\"unexpected\"}");

            assertThat(adapter.fetch(TestContexts.helsinki().registry().build())).isEmpty();
            server.verify();
        }
    }

    @Nested
    @DisplayName("Endpoint resolution")
    class Resolution {

        @Test
        void resolvedOnceAndReused() {
            QueryContext ctx = TestContexts.helsinki().registry().build();
            expectSearch("0", hits());
            expectSearch("0", hits());

            adapter.fetch(ctx);
            adapter.fetch(ctx);

            verify(resolver, times(1)).resolve(any());
        }

        @Test
        void failureIsNotCached() {
            QueryContext ctx = TestContexts.helsinki().registry().build();
            when(resolver.resolve(any()))
                    .thenThrow(new EndpointResolutionException("nothing answered"))
                    .thenReturn(ENDPOINT);
            expectSearch("0", hits());

            assertThatThrownBy(() -> adapter.fetch(ctx)).isInstanceOf(EndpointResolutionException.class);
            assertThat(adapter.fetch(ctx)).isEmpty();
            verify(resolver, times(2)).resolve(any());
        }
    }
}
