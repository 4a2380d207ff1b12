package com.buhmwoo.docsearch.modules.search.application.source;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 문서 메타데이터 저장소가 돌려주는 문서 정보입니다. // ✅ 결과 표시용 이름/요약/분류만 사용합니다.
 */
public record DocumentMetadata(
        String id,
        String name,
        String summary,
        String category,
        List<String> tags,
        LocalDateTime createdAt
) {

    public DocumentMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
