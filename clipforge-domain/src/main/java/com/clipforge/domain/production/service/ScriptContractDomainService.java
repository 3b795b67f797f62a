package com.clipforge.domain.production.service;

import com.clipforge.domain.production.model.valobj.ScriptResult;
import com.clipforge.types.common.Constants;
import com.clipforge.types.exception.ContractValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 脚本结构约定：必须拆成三段，每段台词词数落在各自区间内。
 * <p>
 * 词数越界只记为风险，不终止流水线；无法拆出三段非空台词则校验失败。
 * </p>
 */
@Slf4j
@Service
public class ScriptContractDomainService {

    private static final int[][] WORD_BANDS = {
            {18, 22},
            {20, 24},
            {17, 20}
    };

    private final ScriptSceneParser scriptSceneParser;

    public ScriptContractDomainService(ScriptSceneParser scriptSceneParser) {
        this.scriptSceneParser = scriptSceneParser;
    }

    public ScriptResult evaluate(String script) {
        List<ScriptSceneParser.ParsedScene> scenes = scriptSceneParser.parse(script);
        if (scenes.size() != Constants.STORYBOARD_SCENE_COUNT) {
            throw new ContractValidationException("Script must decompose into "
                    + Constants.STORYBOARD_SCENE_COUNT + " scenes, got " + scenes.size());
        }
        List<String> dialogues = new ArrayList<>();
        List<Integer> wordCounts = new ArrayList<>();
        List<BigDecimal> durations = new ArrayList<>();
        List<String> risks = new ArrayList<>();
        for (int i = 0; i < scenes.size(); i++) {
            ScriptSceneParser.ParsedScene scene = scenes.get(i);
            int words = scriptSceneParser.countWords(scene.dialogue());
            dialogues.add(scene.dialogue());
            wordCounts.add(words);
            durations.add(scene.durationSeconds());
            int min = WORD_BANDS[i][0];
            int max = WORD_BANDS[i][1];
            if (words < min) {
                risks.add("Scene " + (i + 1) + " has " + words + " words, below minimum " + min);
            } else if (words > max) {
                risks.add("Scene " + (i + 1) + " has " + words + " words, above maximum " + max);
            }
        }
        if (!risks.isEmpty()) {
            log.warn("Script violates word bands. wordCounts={}, risks={}", wordCounts, risks);
        }
        return ScriptResult.builder()
                .text(script)
                .sceneDialogues(dialogues)
                .wordCounts(wordCounts)
                .markedDurations(durations)
                .risks(risks)
                .build();
    }

    public int minWords(int sceneIndex) {
        return WORD_BANDS[sceneIndex][0];
    }

    public int maxWords(int sceneIndex) {
        return WORD_BANDS[sceneIndex][1];
    }
}
