package com.ipcsentinel.core.mediator;

import com.ipcsentinel.core.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InputSanitizers}.
 */
class InputSanitizersTest {

    @Test
    @DisplayName("Should reject plain and encoded traversal sequences")
    void shouldRejectTraversal() {
        for (String path : new String[] {"../etc/passwd", "a\\..\\b", "%2E%2E/secret", "x/%2e%2e%2fy", "..%5Cwin"}) {
            assertThatThrownBy(() -> InputSanitizers.sanitizePath(path))
                    .as(path)
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessage("Path traversal detected");
        }
    }

    @Test
    @DisplayName("Should normalize backslashes and repeated slashes")
    void shouldNormalizeSeparators() {
        assertThat(InputSanitizers.sanitizePath("docs\\reports//2024///q1.pdf"))
                .isEqualTo("docs/reports/2024/q1.pdf");
        assertThat(InputSanitizers.sanitizePath("notes.v2.txt")).isEqualTo("notes.v2.txt");
    }

    @Test
    @DisplayName("Should reject common SQL injection shapes")
    void shouldRejectSqlInjection() {
        String[] queries = {
                "1; DROP TABLE users",
                "name'; delete from t",
                "x -- comment",
                "a /* b */",
                "1 UNION ALL SELECT password FROM users",
                "' OR 1=1 OR '"
        };
        for (String query : queries) {
            assertThatThrownBy(() -> InputSanitizers.sanitizeSql(query))
                    .as(query)
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessage("Potential SQL injection detected");
        }
    }

    @Test
    @DisplayName("Should pass ordinary query text through unchanged")
    void shouldAcceptOrdinaryQuery() {
        assertThat(InputSanitizers.sanitizeSql("quarterly report for Union Square"))
                .isEqualTo("quarterly report for Union Square");
    }

    @Test
    @DisplayName("Should reject non-string arguments in the operator adapters")
    void shouldRejectNonStringArguments() {
        assertThatThrownBy(() -> InputSanitizers.PATH.apply(42))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("string");
        assertThat(InputSanitizers.SQL.apply("plain")).isEqualTo("plain");
    }
}
