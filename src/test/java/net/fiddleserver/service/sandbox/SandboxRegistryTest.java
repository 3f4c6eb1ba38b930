package net.fiddleserver.service.sandbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Set;
import net.fiddleserver.config.CacheFactory;
import net.fiddleserver.support.s3.ObjectStore;
import org.junit.jupiter.api.Test;

class SandboxRegistryTest {

    @Test
    void should_StripDelimiterFromPrefixes_When_Enumerating() {
        ObjectStore objectStore = mock(ObjectStore.class);
        when(objectStore.listCommonPrefixes("/")).thenReturn(List.of("1.0/", "1.9/", "2.0/"));
        when(objectStore.bucketName()).thenReturn("sandbox-bundles");

        SandboxRegistry registry = SandboxRegistry.enumerate(objectStore, new CacheFactory());

        assertThat(registry.versions()).containsExactly("1.0", "1.9", "2.0");
        assertThat(registry.reader("1.9")).isPresent();
        assertThat(registry.latestVersion()).contains("2.0");
    }

    @Test
    void should_SkipEmptyPrefix_When_BucketHasRootSeparator() {
        ObjectStore objectStore = mock(ObjectStore.class);
        when(objectStore.listCommonPrefixes("/")).thenReturn(List.of("/", "1.0/"));
        when(objectStore.bucketName()).thenReturn("sandbox-bundles");

        SandboxRegistry registry = SandboxRegistry.enumerate(objectStore, new CacheFactory());

        assertThat(registry.versions()).containsExactly("1.0");
    }

    @Test
    void should_HaveNoLatestVersion_When_BucketIsEmpty() {
        ObjectStore objectStore = mock(ObjectStore.class);
        when(objectStore.listCommonPrefixes("/")).thenReturn(List.of());
        when(objectStore.bucketName()).thenReturn("sandbox-bundles");

        SandboxRegistry registry = SandboxRegistry.enumerate(objectStore, new CacheFactory());

        assertThat(registry.versions()).isEmpty();
        assertThat(registry.latestVersion()).isEmpty();
        assertThat(SandboxContext.from(registry).defaultVersion()).isEmpty();
    }

    @Test
    void should_PropagateFailure_When_ListingFails() {
        ObjectStore objectStore = mock(ObjectStore.class);
        when(objectStore.listCommonPrefixes("/")).thenThrow(new IllegalStateException("listing failed"));

        assertThatThrownBy(() -> SandboxRegistry.enumerate(objectStore, new CacheFactory()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("listing failed");
    }

    @Test
    void should_ReturnEmpty_When_VersionIsUnknown() {
        ObjectStore objectStore = mock(ObjectStore.class);
        SandboxRegistry registry = SandboxRegistry.of(Set.of("1.0"),
            version -> new CachedObjectReader(objectStore, version, new CacheFactory().createUnboundedCache(version)));

        assertThat(registry.reader("9.9")).isEmpty();
        assertThat(registry.reader(null)).isEmpty();
    }

    @Test
    void should_RejectMutation_When_VersionsAreExposed() {
        SandboxRegistry registry = SandboxRegistry.of(Set.of("1.0"), version -> null);

        assertThatThrownBy(() -> registry.versions().add("2.0"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
