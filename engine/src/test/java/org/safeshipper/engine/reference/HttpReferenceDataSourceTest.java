package org.safeshipper.engine.reference;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.safeshipper.engine.api.dto.ReferenceDataDto;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpReferenceDataSourceTest {

    private static final String DOCUMENT = "{\"version\":\"remote-7\","
            + "\"hazard_classes\":[{\"code\":\"3\",\"adr_class\":\"CLASS_3\",\"risk_rank\":8}],"
            + "\"equipment_requirements\":[{\"adr_class\":\"ALL_CLASSES\","
            + "\"equipment_type_id\":\"FIRST_AID_KIT\",\"name\":\"First Aid Kit\"}]}";

    private MockWebServer server;
    private HttpReferenceDataSource source;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        source = new HttpReferenceDataSource(server.url("/api/").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldFetchReferenceData() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody(DOCUMENT));

        ReferenceDataDto data = source.load();

        assertThat(data.getVersion()).isEqualTo("remote-7");
        assertThat(ReferenceDataRegistry.fromDto(data).getHazardClasses().isKnown("3")).isTrue();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/api/v1/compliance/reference-data");
    }

    @Test
    void shouldFailOnErrorStatus() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> source.load())
                .isInstanceOf(ReferenceDataException.class)
                .hasMessageContaining("503");
    }

    @Test
    void shouldFailOnUnreadableBody() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("<html>maintenance</html>"));

        assertThatThrownBy(() -> source.load())
                .isInstanceOf(ReferenceDataException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void shouldDescribeEndpoint() {
        assertThat(source.describe()).isEqualTo(server.url("/api/").toString() + "v1/compliance/reference-data");
    }
}
