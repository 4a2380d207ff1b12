package com.buhmwoo.docsearch.modules.search.api.dto;

import com.buhmwoo.docsearch.modules.search.application.ranking.MatchDetail;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchDetailDto {

    private String term;
    private double score;
    private List<Integer> positions;
    private boolean fuzzy;

    public static MatchDetailDto from(MatchDetail detail) {
        return MatchDetailDto.builder()
                .term(detail.term())
                .score(detail.score())
                .positions(detail.positions())
                .fuzzy(detail.wasFuzzy())
                .build();
    }
}
