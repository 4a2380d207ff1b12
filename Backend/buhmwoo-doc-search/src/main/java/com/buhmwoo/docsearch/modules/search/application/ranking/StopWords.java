package com.buhmwoo.docsearch.modules.search.application.ranking;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 질의 파싱 시 제거할 기능어 목록입니다. 영어와 태국어 기본 목록에 설정값을 덧붙일 수 있습니다.
 */
public final class StopWords {

    public static final Set<String> ENGLISH = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "are", "was", "were", "be", "been", "being", "have", "has", "had", "do", "does", "did",
            "will", "would", "could", "should", "may", "might", "must", "can", "this", "that", "these", "those"
    );

    public static final Set<String> THAI = Set.of(
            "ที่", "และ", "หรือ", "แต่", "ใน", "บน", "เพื่อ", "ของ", "กับ", "โดย", "ได้",
            "เป็น", "มี", "จาก", "ไป", "มา", "ก็", "จะ", "ถึง", "ให้", "ยัง", "คือ", "ว่า",
            "นี้", "นั้น", "นะ", "ครับ", "ค่ะ", "คะ", "ไหม", "มั้ย", "อะไร", "เมื่อไหร่", "ที่ไหน",
            "ทำไม", "อย่างไร", "ใคร", "ขอ", "ช่วย", "บอก", "ดู", "อยู่", "เอา", "ลอง",
            "หา", "ต้อง", "อยาก", "ไม่", "ไม่ได้", "ไม่มี", "แล้ว", "เลย", "เดี๋ยว", "เอง"
    );

    private StopWords() {
    }

    public static Set<String> defaults() {
        return with(Set.of());
    }

    public static Set<String> with(Collection<String> extra) {
        Set<String> merged = new LinkedHashSet<>(ENGLISH);
        merged.addAll(THAI);
        if (extra != null) {
            extra.stream()
                    .filter(word -> word != null && !word.isBlank())
                    .map(word -> word.trim().toLowerCase(Locale.ROOT))
                    .forEach(merged::add);
        }
        return Set.copyOf(merged);
    }
}
