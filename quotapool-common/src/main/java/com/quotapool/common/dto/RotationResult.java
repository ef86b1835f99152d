package com.quotapool.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 手动轮换 Key 的结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RotationResult {

    private boolean rotated;

    private int previousIndex;

    private int activeIndex;

    private boolean forced;
}
