package com.whereq.vigil.validation;

import com.whereq.vigil.exception.ScanValidationException;
import com.whereq.vigil.model.ScanProfile;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArgumentSanitizerTest {

    @Test
    void leavesPlainOptionsUntouched() {
        assertThat(ArgumentSanitizer.sanitize("-T4   -F")).isEqualTo("-T4 -F");
        assertThat(ArgumentSanitizer.sanitize(ScanProfile.COMPREHENSIVE.getArguments()))
            .isEqualTo(ScanProfile.COMPREHENSIVE.getArguments());
    }

    @Test
    void quotesShellMetacharacters() {
        String sanitized = ArgumentSanitizer.sanitize("-sV ; rm -rf / && echo $(id)");

        assertThat(sanitized).isEqualTo("-sV ';' rm -rf / '&&' echo '$(id)'");
        assertThat(ArgumentSanitizer.tokenize(sanitized))
            .containsExactly("-sV", ";", "rm", "-rf", "/", "&&", "echo", "$(id)");
    }

    @Test
    void keepsQuotedWordsTogether() {
        assertThat(ArgumentSanitizer.tokenize("--script-args 'user=admin pass=x' -p \"22,80\""))
            .containsExactly("--script-args", "user=admin pass=x", "-p", "22,80");
        assertThat(ArgumentSanitizer.sanitize("--script-args 'user=admin pass=x'"))
            .isEqualTo("--script-args 'user=admin pass=x'");
    }

    @Test
    void escapesEmbeddedSingleQuotes() {
        String sanitized = ArgumentSanitizer.sanitize("\"it's\"");

        assertThat(sanitized).isEqualTo("'it'\"'\"'s'");
        assertThat(ArgumentSanitizer.tokenize(sanitized)).containsExactly("it's");
    }

    @Test
    void sanitizingTwiceYieldsTheSameCommand() {
        String[] inputs = {
            "-T4 -F",
            "-sV --version-intensity 5",
            "--script 'http-title and not brute' -p 80,443",
            "a\\ b \"c d\" 'e|f' `g`",
            ""
        };

        for (String input : inputs) {
            String once = ArgumentSanitizer.sanitize(input);
            String twice = ArgumentSanitizer.sanitize(once);
            assertThat(ArgumentSanitizer.tokenize(twice)).isEqualTo(ArgumentSanitizer.tokenize(once));
            assertThat(twice).isEqualTo(once);
        }
    }

    @Test
    void emptyTokenIsQuoted() {
        assertThat(ArgumentSanitizer.sanitize("-p ''")).isEqualTo("-p ''");
    }

    @Test
    void rejectsUnterminatedQuotes() {
        assertThatThrownBy(() -> ArgumentSanitizer.sanitize("-sV 'oops"))
            .isInstanceOf(ScanValidationException.class)
            .hasMessageContaining("No closing quotation");
        assertThatThrownBy(() -> ArgumentSanitizer.sanitize("-sV \\"))
            .isInstanceOf(ScanValidationException.class);
    }
}
