package com.notibag.sender;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SenderArgumentsTest {

    private static final String DEFAULT_HOST = "http://localhost:8080";

    @Test
    void parse_SingleDashFlags() {
        SenderArguments arguments = SenderArguments.parse(
                new String[]{"-title", "Build done", "-message", "Target X compiled"}, DEFAULT_HOST);

        assertThat(arguments.getTitle()).isEqualTo("Build done");
        assertThat(arguments.getMessage()).isEqualTo("Target X compiled");
        assertThat(arguments.getHost()).isEqualTo(DEFAULT_HOST);
        assertThat(arguments.isComplete()).isTrue();
    }

    @Test
    void parse_DoubleDashAndEqualsForms() {
        SenderArguments arguments = SenderArguments.parse(
                new String[]{"--title", "Deploy", "-message=prod finished", "--host=http://hub:9000"}, DEFAULT_HOST);

        assertThat(arguments.getTitle()).isEqualTo("Deploy");
        assertThat(arguments.getMessage()).isEqualTo("prod finished");
        assertThat(arguments.getHost()).isEqualTo("http://hub:9000");
    }

    @Test
    void parse_ValueContainingEquals_KeepsEverythingAfterFirstEquals() {
        SenderArguments arguments = SenderArguments.parse(
                new String[]{"-title=a=b", "-message", "x"}, DEFAULT_HOST);

        assertThat(arguments.getTitle()).isEqualTo("a=b");
    }

    @Test
    void parse_MissingMessage_IsIncomplete() {
        SenderArguments arguments = SenderArguments.parse(new String[]{"-title", "only"}, DEFAULT_HOST);

        assertThat(arguments.isComplete()).isFalse();
    }

    @Test
    void parse_EmptyTitle_IsIncomplete() {
        SenderArguments arguments = SenderArguments.parse(new String[]{"-title=", "-message", "m"}, DEFAULT_HOST);

        assertThat(arguments.isComplete()).isFalse();
    }

    @Test
    void parse_FlagWithoutValue_Throws() {
        assertThatThrownBy(() -> SenderArguments.parse(new String[]{"-title", "t", "-message"}, DEFAULT_HOST))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-message");
    }

    @Test
    void parse_UnknownFlag_Throws() {
        assertThatThrownBy(() -> SenderArguments.parse(new String[]{"-priority", "high"}, DEFAULT_HOST))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown flag: -priority");
    }

    @Test
    void parse_PositionalArgument_Throws() {
        assertThatThrownBy(() -> SenderArguments.parse(new String[]{"hello"}, DEFAULT_HOST))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unexpected argument: hello");
    }
}
