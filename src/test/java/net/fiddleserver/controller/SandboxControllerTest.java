package net.fiddleserver.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import net.fiddleserver.application.sandbox.SandboxAssetUseCase;
import net.fiddleserver.application.sandbox.SandboxPageUseCase;
import net.fiddleserver.config.CacheFactory;
import net.fiddleserver.domain.sandbox.FileContent;
import net.fiddleserver.service.s3.S3FetchResult;
import net.fiddleserver.service.sandbox.CachedObjectReader;
import net.fiddleserver.service.sandbox.SandboxContext;
import net.fiddleserver.service.sandbox.SandboxRegistry;
import net.fiddleserver.support.s3.ObjectStore;
import net.fiddleserver.support.template.PlaceholderTemplateRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import tools.jackson.databind.json.JsonMapper;

class SandboxControllerTest {

    private static final String TEMPLATE = "<html data-v=\"{{sandbox-version}}\"><script>var o={{opts|json|safe}};</script></html>";

    private ObjectStore objectStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        objectStore = mock(ObjectStore.class);
        CacheFactory cacheFactory = new CacheFactory();
        SandboxRegistry registry = SandboxRegistry.of(Set.of("1.0", "2.0"),
            version -> new CachedObjectReader(objectStore, version, cacheFactory.createUnboundedCache(version)));
        SandboxContext context = SandboxContext.from(registry);
        SandboxController controller = new SandboxController(
            new SandboxPageUseCase(context, new PlaceholderTemplateRenderer(JsonMapper.builder().build()), () -> "t"),
            new SandboxAssetUseCase(context));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void should_RenderLatestVersion_When_RootIsRequested() throws Exception {
        stubIndex("2.0");

        mockMvc.perform(get("/"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
            .andExpect(content().string(containsString("data-v=\"2.0\"")));
    }

    @Test
    void should_RenderRequestedVersion_When_SandboxPageIsRequested() throws Exception {
        stubIndex("1.0");

        mockMvc.perform(get("/sandbox/1.0"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("data-v=\"1.0\"")));
    }

    @Test
    void should_PassGistId_When_GistPageIsRequested() throws Exception {
        stubIndex("2.0");
        stubIndex("1.0");

        String latest = mockMvc.perform(get("/gist/abc"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        String versioned = mockMvc.perform(get("/gist/1.0/abc"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();

        assertThat(latest).contains("data-v=\"2.0\"").contains("\"gist_id\":\"abc\"");
        assertThat(versioned).contains("data-v=\"1.0\"").contains("\"gist_id\":\"abc\"");
    }

    @Test
    void should_Answer404_When_VersionIsUnknown() throws Exception {
        mockMvc.perform(get("/sandbox/9.9")).andExpect(status().isNotFound());
        mockMvc.perform(get("/sandbox/9.9/app.js")).andExpect(status().isNotFound());
    }

    @Test
    void should_ServeNestedAsset_When_FileExists() throws Exception {
        when(objectStore.fetchObject("1.0/js/compiled/app.js")).thenReturn(S3FetchResult.success(new FileContent(
            "app()".getBytes(StandardCharsets.UTF_8), "text/javascript", 5L, null, "\"v1\"")));

        mockMvc.perform(get("/sandbox/1.0/js/compiled/app.js"))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Type", "text/javascript"))
            .andExpect(header().string("ETag", "\"v1\""))
            .andExpect(header().doesNotExist("Last-Modified"))
            .andExpect(content().bytes("app()".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void should_OmitContentTypeAndETag_When_StoreReturnedNoMetadata() throws Exception {
        when(objectStore.fetchObject("1.0/data.edn")).thenReturn(S3FetchResult.success(new FileContent(
            "{:a 1}".getBytes(StandardCharsets.UTF_8), null, null, null, null)));

        mockMvc.perform(get("/sandbox/1.0/data.edn"))
            .andExpect(status().isOk())
            .andExpect(header().doesNotExist("Content-Type"))
            .andExpect(header().doesNotExist("ETag"))
            .andExpect(header().doesNotExist("Content-Disposition"))
            .andExpect(header().doesNotExist("Last-Modified"))
            .andExpect(content().bytes("{:a 1}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void should_Answer404_When_AssetIsMissing() throws Exception {
        when(objectStore.fetchObject("1.0/missing.css")).thenReturn(S3FetchResult.notFound());

        mockMvc.perform(get("/sandbox/1.0/missing.css")).andExpect(status().isNotFound());
    }

    @Test
    void should_Answer502_When_StoreIsUnavailable() throws Exception {
        when(objectStore.fetchObject("1.0/app.js")).thenReturn(S3FetchResult.serviceError("Slow Down"));

        mockMvc.perform(get("/sandbox/1.0/app.js")).andExpect(status().isBadGateway());
    }

    @Test
    void should_StripLeadingSlashes_When_NormalizingCapturedPath() {
        assertThat(SandboxController.stripLeadingSlashes("/js/app.js")).isEqualTo("js/app.js");
        assertThat(SandboxController.stripLeadingSlashes("/")).isEmpty();
        assertThat(SandboxController.stripLeadingSlashes(null)).isEmpty();
    }

    private void stubIndex(String version) {
        when(objectStore.fetchObject(version + "/index.html")).thenReturn(S3FetchResult.success(
            new FileContent(TEMPLATE.getBytes(StandardCharsets.UTF_8), "text/html", null, null, null)));
    }
}
