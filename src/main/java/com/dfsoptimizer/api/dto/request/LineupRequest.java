package com.dfsoptimizer.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** An existing lineup to simulate: player ids in roster slot order. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineupRequest {

    @NotBlank
    private String lineupId;

    @NotEmpty
    private List<String> playerIds;
}
