package com.lmrunner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Pipeline position that triggered a runner invocation.
 * Carried along every call and stamped on streamed chunks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeInfo {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("node_id")
    private UUID nodeId;

    @JsonProperty("node_name")
    private String nodeName;

    @JsonProperty("node_type")
    private String nodeType;

    /**
     * Node info for calls that do not originate from a pipeline node.
     */
    public static NodeInfo detached() {
        return NodeInfo.builder()
                .id(UUID.randomUUID())
                .nodeId(new UUID(0L, 0L))
                .nodeName("direct")
                .nodeType("LLM")
                .build();
    }
}
