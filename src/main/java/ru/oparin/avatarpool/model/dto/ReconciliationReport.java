package ru.oparin.avatarpool.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Итог сверки привязок.
 */
@Data
@Builder
@AllArgsConstructor
public class ReconciliationReport {

    /**
     * Привязки, для которых изображение профиля было восстановлено заново.
     */
    private int repairedCount;

    /**
     * Привязки, удаленные как невосстановимые.
     */
    private int removedCount;
}
