package com.clipforge.domain.production.service;

import com.clipforge.types.common.Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 脚本拆分：优先按 "(Scene N ...)" 标记拆分，缺失时按句子均分为三段。
 * <p>
 * 标记中带有时间区间（如 "(Scene 2: 8-17s)"）时解析出场景时长。
 * </p>
 */
@Service
public class ScriptSceneParser {

    private static final Pattern SCENE_MARKER = Pattern.compile("\\(\\s*Scene\\s+(\\d+)([^)]*)\\)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TIME_RANGE = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*s?\\s*[-–]\\s*(\\d+(?:\\.\\d+)?)\\s*s");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    /**
     * @return 拆分出的场景；数量可能少于 3，由调用方判定是否满足约定
     */
    public List<ParsedScene> parse(String script) {
        if (StringUtils.isBlank(script)) {
            return Collections.emptyList();
        }
        List<ParsedScene> marked = parseMarkers(script);
        if (marked.size() >= Constants.STORYBOARD_SCENE_COUNT) {
            return mergeTail(marked);
        }
        String plain = StringUtils.normalizeSpace(SCENE_MARKER.matcher(script).replaceAll(" "));
        return splitSentences(plain);
    }

    public int countWords(String text) {
        if (StringUtils.isBlank(text)) {
            return 0;
        }
        int count = 0;
        for (String token : StringUtils.split(text)) {
            if (token.chars().anyMatch(Character::isLetterOrDigit)) {
                count++;
            }
        }
        return count;
    }

    private List<ParsedScene> parseMarkers(String script) {
        Matcher matcher = SCENE_MARKER.matcher(script);
        List<int[]> bounds = new ArrayList<>();
        List<BigDecimal> durations = new ArrayList<>();
        while (matcher.find()) {
            bounds.add(new int[]{matcher.start(), matcher.end()});
            durations.add(parseDuration(matcher.group(2)));
        }
        List<ParsedScene> scenes = new ArrayList<>();
        for (int i = 0; i < bounds.size(); i++) {
            int from = bounds.get(i)[1];
            int to = i + 1 < bounds.size() ? bounds.get(i + 1)[0] : script.length();
            String dialogue = cleanDialogue(script.substring(from, to));
            if (StringUtils.isNotBlank(dialogue)) {
                scenes.add(new ParsedScene(dialogue, durations.get(i)));
            }
        }
        return scenes;
    }

    private List<ParsedScene> mergeTail(List<ParsedScene> scenes) {
        if (scenes.size() == Constants.STORYBOARD_SCENE_COUNT) {
            return scenes;
        }
        List<ParsedScene> merged = new ArrayList<>(scenes.subList(0, Constants.STORYBOARD_SCENE_COUNT - 1));
        StringBuilder tail = new StringBuilder();
        for (ParsedScene scene : scenes.subList(Constants.STORYBOARD_SCENE_COUNT - 1, scenes.size())) {
            if (tail.length() > 0) {
                tail.append(' ');
            }
            tail.append(scene.dialogue());
        }
        // 合并后的末场景不再有可信的时间区间
        merged.add(new ParsedScene(tail.toString(), null));
        return merged;
    }

    private List<ParsedScene> splitSentences(String text) {
        if (StringUtils.isBlank(text)) {
            return Collections.emptyList();
        }
        List<String> sentences = Arrays.stream(SENTENCE_BREAK.split(text))
                .map(StringUtils::trim)
                .filter(StringUtils::isNotBlank)
                .toList();
        if (sentences.size() < Constants.STORYBOARD_SCENE_COUNT) {
            List<ParsedScene> partial = new ArrayList<>();
            for (String sentence : sentences) {
                partial.add(new ParsedScene(sentence, null));
            }
            return partial;
        }
        int base = sentences.size() / Constants.STORYBOARD_SCENE_COUNT;
        int remainder = sentences.size() % Constants.STORYBOARD_SCENE_COUNT;
        List<ParsedScene> scenes = new ArrayList<>();
        int cursor = 0;
        for (int i = 0; i < Constants.STORYBOARD_SCENE_COUNT; i++) {
            int size = base + (i < remainder ? 1 : 0);
            String dialogue = String.join(" ", sentences.subList(cursor, cursor + size));
            scenes.add(new ParsedScene(dialogue, null));
            cursor += size;
        }
        return scenes;
    }

    private BigDecimal parseDuration(String markerTail) {
        if (StringUtils.isBlank(markerTail)) {
            return null;
        }
        Matcher matcher = TIME_RANGE.matcher(markerTail);
        if (!matcher.find()) {
            return null;
        }
        BigDecimal start = new BigDecimal(matcher.group(1));
        BigDecimal end = new BigDecimal(matcher.group(2));
        BigDecimal duration = end.subtract(start);
        return duration.signum() > 0 ? duration : null;
    }

    private String cleanDialogue(String raw) {
        String text = StringUtils.normalizeSpace(raw);
        text = StringUtils.strip(text, " :-\"'");
        return text;
    }

    /**
     * @param dialogue        台词
     * @param durationSeconds 标记解析出的时长，缺失为 null
     */
    public record ParsedScene(String dialogue, BigDecimal durationSeconds) {
    }
}
