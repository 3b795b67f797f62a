package com.clipforge.domain.production.model.valobj;

import com.clipforge.types.common.Constants;
import com.clipforge.types.exception.ContractValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 分镜规格：固定三个场景，总时长属于允许集合 {10, 15, 25}。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoryboardSpec {

    private List<StoryboardScene> scenes;

    private Integer totalSeconds;

    public BigDecimal durationSum() {
        BigDecimal sum = BigDecimal.ZERO;
        if (scenes == null) {
            return sum;
        }
        for (StoryboardScene scene : scenes) {
            if (scene != null && scene.getDurationSeconds() != null) {
                sum = sum.add(scene.getDurationSeconds());
            }
        }
        return sum;
    }

    public void validate() {
        if (scenes == null || scenes.size() != Constants.STORYBOARD_SCENE_COUNT) {
            throw new ContractValidationException("Storyboard must contain exactly "
                    + Constants.STORYBOARD_SCENE_COUNT + " scenes");
        }
        if (totalSeconds == null || !Constants.ALLOWED_STORYBOARD_TOTALS.contains(totalSeconds)) {
            throw new ContractValidationException("Storyboard total is not allowed: " + totalSeconds);
        }
        if (durationSum().compareTo(BigDecimal.valueOf(totalSeconds)) != 0) {
            throw new ContractValidationException("Scene durations " + durationSum()
                    + " do not add up to total " + totalSeconds);
        }
        for (StoryboardScene scene : scenes) {
            if (scene.getDurationSeconds() == null || scene.getDurationSeconds().signum() <= 0) {
                throw new ContractValidationException("Scene duration must be positive. index=" + scene.getIndex());
            }
        }
    }
}
