package com.ipcsentinel.core.sender;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SenderValidator}.
 */
class SenderValidatorTest {

    private static final List<String> ALLOWED = List.of("app://bundle", "https://trusted.example.com");

    @Test
    @DisplayName("Should reject a missing frame")
    void shouldRejectMissingFrame() {
        SenderValidationResult result = SenderValidator.validateSender(null, ALLOWED);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getReason()).contains(SenderValidator.REASON_NO_FRAME);
        assertThat(result.getOrigin()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an iframe even when its origin is allowed")
    void shouldRejectIframeRegardlessOfAllowList() {
        SenderFrame frame = new SenderFrame("https://trusted.example.com/embed", true, 7);

        SenderValidationResult withList = SenderValidator.validateSender(frame, ALLOWED);
        SenderValidationResult withoutList = SenderValidator.validateSender(frame);

        assertThat(withList.isValid()).isFalse();
        assertThat(withList.getReason()).contains(SenderValidator.REASON_IFRAME);
        assertThat(withList.getOrigin()).contains("https://trusted.example.com");
        assertThat(withList.getFrameId()).contains(7);
        assertThat(withoutList.isValid()).isFalse();
    }

    @Test
    @DisplayName("Should accept any top-level origin when the allow-list is empty")
    void shouldAcceptAnyOriginWithEmptyAllowList() {
        SenderFrame frame = SenderFrame.topLevel("https://anything.example.org/page");

        assertThat(SenderValidator.validateSender(frame, List.of()).isValid()).isTrue();
        assertThat(SenderValidator.validateSender(frame, null).isValid()).isTrue();
    }

    @Test
    @DisplayName("Should accept an allowed origin and report it")
    void shouldAcceptAllowedOrigin() {
        SenderValidationResult result = SenderValidator.validateSender(
                new SenderFrame("app://bundle/index.html", false, 1), ALLOWED);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getReason()).isEmpty();
        assertThat(result.getOrigin()).contains("app://bundle");
        assertThat(result.getFrameId()).contains(1);
    }

    @Test
    @DisplayName("Should reject an origin missing from the allow-list")
    void shouldRejectUnlistedOrigin() {
        SenderValidationResult result = SenderValidator.validateSender(
                SenderFrame.topLevel("https://evil.example.com/"), ALLOWED);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getReason()).contains(SenderValidator.REASON_ORIGIN);
        assertThat(result.getOrigin()).contains("https://evil.example.com");
    }

    @Test
    @DisplayName("Should reject malformed and relative URLs")
    void shouldRejectInvalidUrls() {
        for (String url : new String[] {"not a url", "relative/path", "", "http://"}) {
            SenderValidationResult result = SenderValidator.validateSender(SenderFrame.topLevel(url));
            assertThat(result.isValid()).as(url).isFalse();
            assertThat(result.getReason()).as(url).contains(SenderValidator.REASON_INVALID_URL);
        }
    }

    @Test
    @DisplayName("Should drop default ports and keep explicit ones")
    void shouldSerializeOrigins() {
        assertThat(SenderValidator.originOf("https://Example.com:443/a?b=c")).isEqualTo("https://example.com");
        assertThat(SenderValidator.originOf("http://localhost:80/")).isEqualTo("http://localhost");
        assertThat(SenderValidator.originOf("http://localhost:3000/x")).isEqualTo("http://localhost:3000");
        assertThat(SenderValidator.originOf("file:///opt/app/index.html")).isEqualTo("file://");
        assertThat(SenderValidator.originOf("about:blank")).isEqualTo("null");
    }

    @Test
    @DisplayName("Should fail origin serialization for URLs without a scheme")
    void shouldFailOriginWithoutScheme() {
        assertThatThrownBy(() -> SenderValidator.originOf("/index.html"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no scheme");
    }
}
