package com.linlay.agentruntime.stream.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentBlockTableTest {

    @Test
    void shouldTrackLifecycleAndAccumulateToolArguments() {
        ContentBlockTable table = new ContentBlockTable();

        table.open("call_1", ContentBlockTable.BlockKind.TOOL_CALL, "weather");
        assertThat(table.state("call_1")).contains(ContentBlockTable.BlockState.OPEN);

        table.append("call_1", ContentBlockTable.BlockKind.TOOL_CALL, "{\"a\":");
        table.append("call_1", ContentBlockTable.BlockKind.TOOL_CALL, "1}");
        assertThat(table.state("call_1")).contains(ContentBlockTable.BlockState.ACCUMULATING);

        ContentBlockTable.Block closed = table.close("call_1");
        assertThat(closed.toolName()).isEqualTo("weather");
        assertThat(closed.arguments()).isEqualTo("{\"a\":1}");
        assertThat(table.state("call_1")).contains(ContentBlockTable.BlockState.CLOSED);
        assertThat(table.state("other")).isEmpty();
    }

    @Test
    void shouldRejectIllegalTransitions() {
        ContentBlockTable table = new ContentBlockTable();
        table.open("r", ContentBlockTable.BlockKind.REASONING, null);

        assertThatThrownBy(() -> table.open("r", ContentBlockTable.BlockKind.REASONING, null))
                .isInstanceOf(StreamProtocolException.class)
                .hasMessageContaining("already open");
        assertThatThrownBy(() -> table.append("r", ContentBlockTable.BlockKind.TEXT, "x"))
                .isInstanceOf(StreamProtocolException.class);
        assertThatThrownBy(() -> table.append("missing", ContentBlockTable.BlockKind.TEXT, "x"))
                .isInstanceOf(StreamProtocolException.class)
                .hasMessageContaining("unknown");

        table.close("r");

        assertThatThrownBy(() -> table.close("r")).isInstanceOf(StreamProtocolException.class);
        assertThatThrownBy(() -> table.append("r", ContentBlockTable.BlockKind.REASONING, "x"))
                .isInstanceOf(StreamProtocolException.class)
                .hasMessageContaining("closed");
        assertThatThrownBy(() -> table.open("r", ContentBlockTable.BlockKind.REASONING, null))
                .isInstanceOf(StreamProtocolException.class)
                .hasMessageContaining("reopened");
    }

    @Test
    void openBlockIdsShouldKeepOpenOrder() {
        ContentBlockTable table = new ContentBlockTable();
        table.open("b", ContentBlockTable.BlockKind.TEXT, null);
        table.open("a", ContentBlockTable.BlockKind.REASONING, null);
        table.open("c", ContentBlockTable.BlockKind.TOOL_CALL, "t");
        table.close("a");

        assertThat(table.openBlockIds()).containsExactly("b", "c");
    }
}
