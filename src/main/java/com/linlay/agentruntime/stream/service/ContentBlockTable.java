package com.linlay.agentruntime.stream.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle bookkeeping for the content blocks of one response:
 * absent, then {@link BlockState#OPEN}, then {@link BlockState#ACCUMULATING} on deltas, then
 * {@link BlockState#CLOSED}. A closed id can never be reused.
 */
public final class ContentBlockTable {

    public enum BlockKind {
        TEXT,
        REASONING,
        TOOL_CALL
    }

    public enum BlockState {
        OPEN,
        ACCUMULATING,
        CLOSED
    }

    private final Map<String, Block> blocks = new LinkedHashMap<>();

    public Block open(String id, BlockKind kind, String toolName) {
        if (id == null || id.isBlank()) {
            throw new StreamProtocolException("content block id must not be blank");
        }
        Block existing = blocks.get(id);
        if (existing != null) {
            throw new StreamProtocolException(existing.state == BlockState.CLOSED
                    ? "content block reopened after close: " + id
                    : "content block already open: " + id);
        }
        Block block = new Block(id, kind, toolName);
        blocks.put(id, block);
        return block;
    }

    public Block append(String id, BlockKind expectedKind, String delta) {
        Block block = requireOpen(id, "delta");
        if (block.kind != expectedKind) {
            throw new StreamProtocolException(expectedKind + " delta for " + block.kind + " block: " + id);
        }
        block.state = BlockState.ACCUMULATING;
        if (block.kind == BlockKind.TOOL_CALL && delta != null) {
            block.arguments.append(delta);
        }
        return block;
    }

    public Block close(String id) {
        Block block = requireOpen(id, "end");
        block.state = BlockState.CLOSED;
        return block;
    }

    public Optional<BlockState> state(String id) {
        Block block = blocks.get(id);
        return block == null ? Optional.empty() : Optional.of(block.state);
    }

    public boolean isOpen(String id) {
        Block block = id == null ? null : blocks.get(id);
        return block != null && block.state != BlockState.CLOSED;
    }

    /**
     * Ids of blocks not yet closed, in the order they were opened.
     */
    public List<String> openBlockIds() {
        List<String> ids = new ArrayList<>();
        for (Block block : blocks.values()) {
            if (block.state != BlockState.CLOSED) {
                ids.add(block.id);
            }
        }
        return ids;
    }

    private Block requireOpen(String id, String operation) {
        Block block = id == null ? null : blocks.get(id);
        if (block == null) {
            throw new StreamProtocolException(operation + " for unknown content block: " + id);
        }
        if (block.state == BlockState.CLOSED) {
            throw new StreamProtocolException(operation + " for closed content block: " + id);
        }
        return block;
    }

    public static final class Block {

        private final String id;
        private final BlockKind kind;
        private final String toolName;
        private final StringBuilder arguments = new StringBuilder();
        private BlockState state = BlockState.OPEN;

        private Block(String id, BlockKind kind, String toolName) {
            this.id = id;
            this.kind = kind;
            this.toolName = toolName;
        }

        public String id() {
            return id;
        }

        public BlockKind kind() {
            return kind;
        }

        public String toolName() {
            return toolName;
        }

        public String arguments() {
            return arguments.toString();
        }

        public BlockState state() {
            return state;
        }
    }
}
