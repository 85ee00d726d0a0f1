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
public class ConversationDetailDto {
    private String id;
    private String state;
    private int turnIndex;
    private List<SpeakerDto> speakers;
    private String selection;
    private String createdAt;
    private List<TranscriptEntryDto> transcript;
    private boolean converged;
}
