package me.golemcore.mcp.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationCreatedResponse {
    @JsonProperty("conversation_id")
    private String conversationId;

    @JsonProperty("created_at")
    private String createdAt;
}
