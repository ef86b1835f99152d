package com.quotapool.dispatcher.rotation;

import com.quotapool.dispatcher.model.CredentialRecord;

import java.util.List;
import java.util.OptionalInt;

/**
 * Key 轮换决策，只读取池快照，不修改任何记录。
 * <p>
 * 两级阈值：
 * <ul>
 *   <li>预警阈值：用量达到后主动换走，在配额真正耗尽前完成切换</li>
 *   <li>紧急阈值：用量达到后普通轮换跳过该 Key，只有强制轮换才会选中</li>
 * </ul>
 */
public class RotationPolicy {

    private final int maxConsecutiveErrors;

    public RotationPolicy(int maxConsecutiveErrors) {
        this.maxConsecutiveErrors = maxConsecutiveErrors;
    }

    /**
     * 是否应当主动换走当前 Key：用量达到预警阈值，或连续失败次数达到上限。
     */
    public boolean shouldRotateAway(CredentialRecord record, long warnThreshold) {
        return record.getQuotaUsed() >= warnThreshold
                || record.getErrorCount() >= maxConsecutiveErrors;
    }

    /**
     * 从 {@code startIndex} 的下一个位置开始环形扫描，最多扫描一整圈（含起点本身），
     * 返回第一个可用 Key 的序号。
     * <p>
     * 跳过已停用的 Key；非强制模式下还跳过用量达到紧急阈值的 Key。
     * 同条件下按扫描顺序取第一个，不按剩余配额排序。
     *
     * @param pool 按序号排列的池快照，第 i 个元素的序号为 i
     * @return 可用 Key 的序号，整圈都不可用时为空
     */
    public OptionalInt selectNext(List<CredentialRecord> pool, int startIndex,
                                  long emergencyThreshold, boolean force) {
        int size = pool.size();
        if (size == 0) {
            return OptionalInt.empty();
        }
        int cursor = Math.floorMod(startIndex, size);
        for (int attempts = 0; attempts < size; attempts++) {
            cursor = (cursor + 1) % size;
            CredentialRecord candidate = pool.get(cursor);
            if (!candidate.isActive()) {
                continue;
            }
            if (!force && candidate.getQuotaUsed() >= emergencyThreshold) {
                continue;
            }
            return OptionalInt.of(cursor);
        }
        return OptionalInt.empty();
    }

    public int getMaxConsecutiveErrors() {
        return maxConsecutiveErrors;
    }
}
