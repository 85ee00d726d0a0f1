package me.golemcore.roundtable.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Roster in speaking order plus the selection policy ({@code round-robin} when
 * omitted).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateConversationRequest {
    @Builder.Default
    private List<SpeakerDto> speakers = new ArrayList<>();
    private String selection;
    private Long seed;
}
