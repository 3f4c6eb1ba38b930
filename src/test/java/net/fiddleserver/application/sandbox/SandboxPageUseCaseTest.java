package net.fiddleserver.application.sandbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.Set;
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
import tools.jackson.databind.json.JsonMapper;

class SandboxPageUseCaseTest {

    private static final String TEMPLATE =
        "<body data-version=\"{{sandbox-version}}\">"
            + "<script>window.opts = {{opts|json|safe}};</script>"
            + "<form>{{anti-forgery|safe}}</form></body>";

    private ObjectStore objectStore;
    private SandboxPageUseCase useCase;

    @BeforeEach
    void setUp() {
        objectStore = mock(ObjectStore.class);
        CacheFactory cacheFactory = new CacheFactory();
        SandboxRegistry registry = SandboxRegistry.of(Set.of("1.0", "1.9", "2.0"),
            version -> new CachedObjectReader(objectStore, version, cacheFactory.createUnboundedCache(version)));
        useCase = new SandboxPageUseCase(
            SandboxContext.from(registry),
            new PlaceholderTemplateRenderer(JsonMapper.builder().build()),
            () -> "token-123");
    }

    @Test
    void should_RenderLatestVersion_When_NoVersionIsRequested() {
        stubIndex("2.0");

        String html = useCase.render(null, null).orElseThrow();

        assertThat(html).contains("data-version=\"2.0\"");
        assertThat(html).contains("window.opts = {\"latest\":\"2.0\"};");
        assertThat(html).contains("<input id=\"__anti-forgery-token\" name=\"__anti-forgery-token\""
            + " type=\"hidden\" value=\"token-123\">");
    }

    @Test
    void should_RenderRequestedVersionWithGist_When_BothAreGiven() {
        stubIndex("1.0");

        String html = useCase.render("1.0", "abc123").orElseThrow();

        assertThat(html).contains("data-version=\"1.0\"");
        assertThat(html).contains("\"latest\":\"2.0\"");
        assertThat(html).contains("\"gist_id\":\"abc123\"");
    }

    @Test
    void should_IncludeGistId_When_LatestVersionIsUsed() {
        stubIndex("2.0");

        String html = useCase.render(null, "deadbeef").orElseThrow();

        assertThat(html).contains("\"gist_id\":\"deadbeef\"");
    }

    @Test
    void should_ReturnEmpty_When_VersionIsUnknown() {
        assertThat(useCase.render("9.9", null)).isEmpty();
        verify(objectStore, never()).fetchObject("9.9/index.html");
    }

    @Test
    void should_ReturnEmpty_When_IndexIsMissing() {
        when(objectStore.fetchObject("1.9/index.html")).thenReturn(S3FetchResult.notFound());

        assertThat(useCase.render("1.9", null)).isEmpty();
    }

    @Test
    void should_ReturnEmpty_When_RegistryHasNoVersions() {
        SandboxPageUseCase emptyUseCase = new SandboxPageUseCase(
            SandboxContext.from(SandboxRegistry.of(Set.of(), version -> null)),
            new PlaceholderTemplateRenderer(JsonMapper.builder().build()),
            () -> "token");

        assertThat(emptyUseCase.render(null, null)).isEmpty();
    }

    @Test
    void should_EscapeToken_When_BuildingAntiForgeryField() {
        assertThat(SandboxPageUseCase.antiForgeryField("a\"b<c"))
            .contains("value=\"a&quot;b&lt;c\"");
    }

    private void stubIndex(String version) {
        when(objectStore.fetchObject(version + "/index.html")).thenReturn(S3FetchResult.success(
            new FileContent(TEMPLATE.getBytes(StandardCharsets.UTF_8), "text/html", null, null, null)));
    }
}
