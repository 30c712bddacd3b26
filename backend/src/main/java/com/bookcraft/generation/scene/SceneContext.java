package com.bookcraft.generation.scene;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单元的场景上下文
 *
 * 封闭的四种变体（动作、对话、氛围、情感），各自携带必需字段，
 * 只能通过静态工厂创建，提示词构造方按类型取用对应写作要求。
 */
public abstract class SceneContext {

    public enum SceneType {
        ACTION("action"),
        DIALOGUE("dialogue"),
        ATMOSPHERIC("atmospheric"),
        EMOTIONAL("emotional");

        private final String code;

        SceneType(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }

        public static SceneType fromCode(String value) {
            if (value != null) {
                String normalized = value.trim().toLowerCase();
                for (SceneType type : values()) {
                    if (type.code.equals(normalized)) {
                        return type;
                    }
                }
            }
            return null;
        }
    }

    private final String setting;
    private final String mood;

    private SceneContext(String setting, String mood) {
        this.setting = StringUtils.defaultIfBlank(setting, "延续上一场景");
        this.mood = StringUtils.defaultIfBlank(mood, "与章节基调一致");
    }

    public abstract SceneType getType();

    /**
     * 推荐的写作温度
     */
    public abstract double getTemperature();

    /**
     * 追加场景专属的写作要求
     */
    protected abstract void appendRequirements(StringBuilder prompt);

    public void appendScenePrompt(StringBuilder prompt) {
        prompt.append("【场景】").append(getType().getCode()).append("\n");
        prompt.append("- 地点：").append(setting).append("\n");
        prompt.append("- 基调：").append(mood).append("\n");
        appendRequirements(prompt);
    }

    public String getSetting() {
        return setting;
    }

    public String getMood() {
        return mood;
    }

    public static SceneContext action(String setting, String mood, String conflict, String stakes) {
        return new ActionScene(setting, mood, conflict, stakes);
    }

    public static SceneContext dialogue(String setting, String mood, List<String> speakers, String subtext) {
        return new DialogueScene(setting, mood, speakers, subtext);
    }

    public static SceneContext atmospheric(String setting, String mood, List<String> sensoryFocus) {
        return new AtmosphericScene(setting, mood, sensoryFocus);
    }

    public static SceneContext emotional(String setting, String mood, String focalCharacter, String innerConflict) {
        return new EmotionalScene(setting, mood, focalCharacter, innerConflict);
    }

    public static final class ActionScene extends SceneContext {

        private final String conflict;
        private final String stakes;

        private ActionScene(String setting, String mood, String conflict, String stakes) {
            super(setting, mood);
            if (StringUtils.isBlank(conflict)) {
                throw new IllegalArgumentException("动作场景必须有冲突");
            }
            this.conflict = conflict;
            this.stakes = StringUtils.defaultIfBlank(stakes, "失败的代价要让读者感受到");
        }

        @Override
        public SceneType getType() {
            return SceneType.ACTION;
        }

        @Override
        public double getTemperature() {
            return 0.75;
        }

        @Override
        protected void appendRequirements(StringBuilder prompt) {
            prompt.append("- 冲突：").append(conflict).append("\n");
            prompt.append("- 赌注：").append(stakes).append("\n");
            prompt.append("- 要求：短句推进节奏，动作清晰可视，每个回合都改变局面。\n");
        }

        public String getConflict() {
            return conflict;
        }
    }

    public static final class DialogueScene extends SceneContext {

        private final List<String> speakers;
        private final String subtext;

        private DialogueScene(String setting, String mood, List<String> speakers, String subtext) {
            super(setting, mood);
            if (speakers == null || speakers.isEmpty()) {
                throw new IllegalArgumentException("对话场景至少需要一名说话者");
            }
            this.speakers = Collections.unmodifiableList(new ArrayList<>(speakers));
            this.subtext = StringUtils.defaultIfBlank(subtext, "人物各有所图，话里有话");
        }

        @Override
        public SceneType getType() {
            return SceneType.DIALOGUE;
        }

        @Override
        public double getTemperature() {
            return 0.7;
        }

        @Override
        protected void appendRequirements(StringBuilder prompt) {
            prompt.append("- 说话者：").append(String.join("、", speakers)).append("\n");
            prompt.append("- 潜台词：").append(subtext).append("\n");
            prompt.append("- 要求：每个人的语气符合身份，对话推动关系或信息变化，少用说明性旁白。\n");
        }

        public List<String> getSpeakers() {
            return speakers;
        }
    }

    public static final class AtmosphericScene extends SceneContext {

        private final List<String> sensoryFocus;

        private AtmosphericScene(String setting, String mood, List<String> sensoryFocus) {
            super(setting, mood);
            this.sensoryFocus = sensoryFocus == null || sensoryFocus.isEmpty()
                    ? Collections.singletonList("光线与声音")
                    : Collections.unmodifiableList(new ArrayList<>(sensoryFocus));
        }

        @Override
        public SceneType getType() {
            return SceneType.ATMOSPHERIC;
        }

        @Override
        public double getTemperature() {
            return 0.85;
        }

        @Override
        protected void appendRequirements(StringBuilder prompt) {
            prompt.append("- 感官重点：").append(String.join("、", sensoryFocus)).append("\n");
            prompt.append("- 要求：以具体细节营造氛围，环境描写服务于情绪与悬念。\n");
        }
    }

    public static final class EmotionalScene extends SceneContext {

        private final String focalCharacter;
        private final String innerConflict;

        private EmotionalScene(String setting, String mood, String focalCharacter, String innerConflict) {
            super(setting, mood);
            if (StringUtils.isBlank(focalCharacter)) {
                throw new IllegalArgumentException("情感场景必须有视角人物");
            }
            this.focalCharacter = focalCharacter;
            this.innerConflict = StringUtils.defaultIfBlank(innerConflict, "欲望与恐惧之间的拉扯");
        }

        @Override
        public SceneType getType() {
            return SceneType.EMOTIONAL;
        }

        @Override
        public double getTemperature() {
            return 0.8;
        }

        @Override
        protected void appendRequirements(StringBuilder prompt) {
            prompt.append("- 视角人物：").append(focalCharacter).append("\n");
            prompt.append("- 内心冲突：").append(innerConflict).append("\n");
            prompt.append("- 要求：通过动作与细节外化情绪，避免直白地宣告感受。\n");
        }

        public String getFocalCharacter() {
            return focalCharacter;
        }
    }
}
