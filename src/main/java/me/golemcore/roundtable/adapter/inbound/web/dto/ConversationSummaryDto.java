package me.golemcore.roundtable.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummaryDto {
    private String id;
    private String state;
    private int turnIndex;
    private List<String> speakers;
    private String selection;
    private int transcriptLength;
    private String createdAt;
}
