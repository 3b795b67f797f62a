package com.clipforge.domain.production.service;

import com.clipforge.domain.production.model.valobj.ScriptResult;
import com.clipforge.domain.production.model.valobj.StoryboardScene;
import com.clipforge.domain.production.model.valobj.StoryboardSpec;
import com.clipforge.types.common.Constants;
import com.clipforge.types.exception.ContractValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 分镜领域服务：把脚本三段台词转为带时长的分镜。
 * <p>
 * 时长取自场景标记，缺失时用默认权重 8/9/8。总和不在允许集合内时，
 * 末场景吸收差值使总和等于最近的允许值（距离相同取较大值）；
 * 吸收后末场景不足 1 秒时改为按默认权重缩放到目标总时长。
 * 任一标记时长缺失或保留一位小数后不为正时，整体使用默认权重。
 * </p>
 */
@Slf4j
@Service
public class StoryboardDomainService {

    private static final List<BigDecimal> DEFAULT_WEIGHTS = List.of(
            new BigDecimal("8.0"),
            new BigDecimal("9.0"),
            new BigDecimal("8.0"));
    private static final BigDecimal DEFAULT_TOTAL = new BigDecimal("25");
    private static final BigDecimal MIN_SCENE_SECONDS = BigDecimal.ONE;
    private static final int SCALE = 1;

    public StoryboardSpec build(ScriptResult script) {
        if (script == null || script.getSceneDialogues() == null
                || script.getSceneDialogues().size() != Constants.STORYBOARD_SCENE_COUNT) {
            throw new ContractValidationException("Storyboard requires a script with "
                    + Constants.STORYBOARD_SCENE_COUNT + " scenes");
        }
        List<BigDecimal> durations = normalizeDurations(resolveDurations(script.getMarkedDurations()));
        List<StoryboardScene> scenes = new ArrayList<>();
        for (int i = 0; i < Constants.STORYBOARD_SCENE_COUNT; i++) {
            scenes.add(StoryboardScene.builder()
                    .index(i + 1)
                    .dialogue(script.getSceneDialogues().get(i))
                    .durationSeconds(durations.get(i))
                    .build());
        }
        StoryboardSpec spec = StoryboardSpec.builder()
                .scenes(scenes)
                .totalSeconds(sum(durations).intValueExact())
                .build();
        spec.validate();
        return spec;
    }

    List<BigDecimal> normalizeDurations(List<BigDecimal> durations) {
        BigDecimal total = sum(durations);
        if (isAllowedTotal(total)) {
            return durations;
        }
        BigDecimal target = nearestAllowedTotal(total);
        BigDecimal head = durations.get(0).add(durations.get(1));
        BigDecimal last = target.subtract(head);
        if (last.compareTo(MIN_SCENE_SECONDS) < 0) {
            log.debug("Final scene cannot absorb remainder, scaling default weights. total={}, target={}", total, target);
            return scaleDefaults(target);
        }
        List<BigDecimal> adjusted = new ArrayList<>(durations.subList(0, 2));
        adjusted.add(last);
        log.debug("Storyboard total adjusted. total={}, target={}, lastScene={}", total, target, last);
        return adjusted;
    }

    BigDecimal nearestAllowedTotal(BigDecimal total) {
        BigDecimal best = null;
        BigDecimal bestDistance = null;
        for (Integer allowed : Constants.ALLOWED_STORYBOARD_TOTALS) {
            BigDecimal candidate = BigDecimal.valueOf(allowed);
            BigDecimal distance = candidate.subtract(total).abs();
            if (best == null
                    || distance.compareTo(bestDistance) < 0
                    || (distance.compareTo(bestDistance) == 0 && candidate.compareTo(best) > 0)) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }

    private List<BigDecimal> resolveDurations(List<BigDecimal> marked) {
        if (marked == null || marked.size() != Constants.STORYBOARD_SCENE_COUNT) {
            return new ArrayList<>(DEFAULT_WEIGHTS);
        }
        List<BigDecimal> durations = new ArrayList<>();
        for (BigDecimal duration : marked) {
            // 取整后仍需为正，0.04 秒这类标记会被舍为 0
            BigDecimal rounded = duration == null ? null : duration.setScale(SCALE, RoundingMode.HALF_UP);
            if (rounded == null || rounded.signum() <= 0) {
                return new ArrayList<>(DEFAULT_WEIGHTS);
            }
            durations.add(rounded);
        }
        return durations;
    }

    private List<BigDecimal> scaleDefaults(BigDecimal target) {
        BigDecimal first = DEFAULT_WEIGHTS.get(0).multiply(target)
                .divide(DEFAULT_TOTAL, SCALE, RoundingMode.HALF_UP);
        BigDecimal second = DEFAULT_WEIGHTS.get(1).multiply(target)
                .divide(DEFAULT_TOTAL, SCALE, RoundingMode.HALF_UP);
        BigDecimal third = target.subtract(first).subtract(second);
        return List.of(first, second, third);
    }

    private boolean isAllowedTotal(BigDecimal total) {
        if (total.stripTrailingZeros().scale() > 0) {
            return false;
        }
        return Constants.ALLOWED_STORYBOARD_TOTALS.contains(total.intValue());
    }

    private BigDecimal sum(List<BigDecimal> values) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            total = total.add(value);
        }
        return total;
    }
}
