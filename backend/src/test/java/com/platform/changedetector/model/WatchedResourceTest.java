package com.platform.changedetector.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.changedetector.TestResources;
import com.platform.changedetector.error.ErrorCode;
import com.platform.changedetector.error.InvalidConfigurationException;
import com.platform.changedetector.error.ResourceFetchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WatchedResource Tests")
class WatchedResourceTest {

    private static final ResourceTypeDescriptor EXTERNAL_SECRETS =
        new ResourceTypeDescriptor("kubernetes-client.io", "v1", "externalsecrets");

    @Test
    @DisplayName("Should prefer selfLink as locator when the server sends it")
    void shouldUseSelfLink() throws Exception {
        JsonNode item = json("""
            {"metadata": {"uid": "u-1", "resourceVersion": "42", "name": "db",
              "namespace": "prod", "selfLink": "/apis/kubernetes-client.io/v1/namespaces/prod/externalsecrets/db"},
             "spec": {"backendType": "secretsManager"}}
            """);

        WatchedResource resource = WatchedResource.fromJson(item, EXTERNAL_SECRETS);

        assertThat(resource.uid()).isEqualTo("u-1");
        assertThat(resource.resourceVersion()).isEqualTo("42");
        assertThat(resource.locator()).isEqualTo("/apis/kubernetes-client.io/v1/namespaces/prod/externalsecrets/db");
        assertThat(resource.object()).isSameAs(item);
    }

    @Test
    @DisplayName("Should derive a namespaced locator when selfLink is absent")
    void shouldDeriveNamespacedLocator() throws Exception {
        JsonNode item = json("""
            {"metadata": {"uid": "u-2", "resourceVersion": "7", "name": "api-keys", "namespace": "team-a"}}
            """);

        WatchedResource resource = WatchedResource.fromJson(item, EXTERNAL_SECRETS);

        assertThat(resource.locator()).isEqualTo("/apis/kubernetes-client.io/v1/namespaces/team-a/externalsecrets/api-keys");
    }

    @Test
    @DisplayName("Should derive a cluster-scoped locator without namespace")
    void shouldDeriveClusterScopedLocator() throws Exception {
        JsonNode item = json("""
            {"metadata": {"uid": "u-3", "resourceVersion": "1", "name": "global"}}
            """);

        assertThat(WatchedResource.fromJson(item, EXTERNAL_SECRETS).locator())
            .isEqualTo("/apis/kubernetes-client.io/v1/externalsecrets/global");
    }

    @Test
    @DisplayName("Should reject an item without uid")
    void shouldRejectMissingUid() throws Exception {
        JsonNode item = json("""
            {"metadata": {"resourceVersion": "1", "name": "broken"}}
            """);

        assertThatThrownBy(() -> WatchedResource.fromJson(item, EXTERNAL_SECRETS))
            .isInstanceOf(ResourceFetchException.class)
            .hasMessageContaining("broken")
            .extracting(e -> ((ResourceFetchException) e).getErrorCode())
            .isEqualTo(ErrorCode.MALFORMED_RESOURCE_RESPONSE);
    }

    @Test
    @DisplayName("Should reject an item without metadata")
    void shouldRejectMissingMetadata() throws Exception {
        assertThatThrownBy(() -> WatchedResource.fromJson(json("{\"kind\": \"ExternalSecret\"}"), EXTERNAL_SECRETS))
            .isInstanceOf(ResourceFetchException.class);
    }

    @Test
    @DisplayName("Should compare version tokens by equality")
    void shouldCompareVersions() {
        assertThat(TestResources.resource("a", "1").versionDiffersFrom(TestResources.resource("a", "1"))).isFalse();
        assertThat(TestResources.resource("a", "1").versionDiffersFrom(TestResources.resource("a", "01"))).isTrue();
    }

    @Test
    @DisplayName("Should require group, version and plural in a descriptor")
    void shouldValidateDescriptor() {
        assertThatThrownBy(() -> new ResourceTypeDescriptor("kubernetes-client.io", " ", "externalsecrets"))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThat(EXTERNAL_SECRETS.collectionPath()).isEqualTo("/apis/kubernetes-client.io/v1/externalsecrets");
        assertThat(EXTERNAL_SECRETS).hasToString("kubernetes-client.io/v1/externalsecrets");
    }

    private static JsonNode json(String text) throws Exception {
        return TestResources.mapper().readTree(text);
    }
}
