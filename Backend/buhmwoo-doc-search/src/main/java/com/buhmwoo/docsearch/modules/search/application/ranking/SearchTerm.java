package com.buhmwoo.docsearch.modules.search.application.ranking;

/**
 * 질의 파싱 결과 하나의 검색어를 표현합니다. // ✅ 생성 후 변경되지 않는 불변 레코드입니다.
 *
 * @param text          소문자로 정규화된 검색어(따옴표 구문은 공백 포함 가능)
 * @param weight        점수 가중치
 * @param fuzzyEligible 정확 일치가 없을 때 퍼지 매칭을 시도할지 여부
 * @param source        검색어 출처
 */
public record SearchTerm(
        String text,
        double weight,
        boolean fuzzyEligible,
        TermSource source
) {
}
