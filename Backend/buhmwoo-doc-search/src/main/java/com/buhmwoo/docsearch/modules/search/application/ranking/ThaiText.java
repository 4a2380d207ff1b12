package com.buhmwoo.docsearch.modules.search.application.ranking;

/**
 * 태국어 근사 비교용 정규화 유틸리티입니다.
 * 성조 부호를 제거하고 장/단모음 쌍을 하나의 표기로 모읍니다.
 */
public final class ThaiText {

    private static final char THAI_BLOCK_START = '\u0E00';
    private static final char THAI_BLOCK_END = '\u0E7F';

    // ่ ้ ๊ ๋ (성조), ์ (묵음), ็ (단모음 표시), ํ (nikhahit)
    private static final String REMOVED_MARKS = "่้๊๋์็ํ";

    private ThaiText() {
    }

    public static boolean containsThai(String text) {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= THAI_BLOCK_START && c <= THAI_BLOCK_END) {
                return true;
            }
        }
        return false;
    }

    /**
     * 성조 부호를 지우고 모음 변형을 대표 문자로 바꾼 비교용 문자열을 돌려줍니다.
     */
    public static String fold(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (REMOVED_MARKS.indexOf(c) >= 0) {
                continue;
            }
            sb.append(canonicalVowel(c));
        }
        return sb.toString();
    }

    private static char canonicalVowel(char c) {
        return switch (c) {
            case 'า' -> 'ะ'; // า → ะ
            case 'ี' -> 'ิ'; // ี → ิ
            case 'ื' -> 'ึ'; // ื → ึ
            case 'ู' -> 'ุ'; // ู → ุ
            case 'แ' -> 'เ'; // แ → เ
            case 'ใ' -> 'ไ'; // ใ → ไ
            default -> c;
        };
    }
}
