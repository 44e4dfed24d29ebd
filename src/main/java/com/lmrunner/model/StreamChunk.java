package com.lmrunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Unit of partial output emitted during a streaming completion.
 * Once sent to a channel it belongs to the receiver.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamChunk {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("node_id")
    private UUID nodeId;

    @JsonProperty("node_name")
    private String nodeName;

    @JsonProperty("node_type")
    private String nodeType;

    @JsonProperty("content")
    private String content;

    public static StreamChunk of(NodeInfo nodeInfo, String content) {
        return StreamChunk.builder()
                .id(nodeInfo.getId())
                .nodeId(nodeInfo.getNodeId())
                .nodeName(nodeInfo.getNodeName())
                .nodeType(nodeInfo.getNodeType())
                .content(content)
                .build();
    }
}
