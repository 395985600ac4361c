package com.jimin.reader.service.reconcile;

/**
 * @param skipped 식별 키(id, link, title)가 하나도 없어서 버린 entry 수
 */
public record ReconcileResult(
        int created,
        int updated,
        int unchanged,
        int skipped
) {
    public int total() {
        return created + updated + unchanged + skipped;
    }
}
