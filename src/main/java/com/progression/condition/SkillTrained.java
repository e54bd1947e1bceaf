package com.progression.condition;

import com.progression.snapshot.SkillNames;

/**
 * Requires training in a skill.
 */
public record SkillTrained(String skill) implements Condition {

    /**
     * Normalized skill key, e.g. "usetheforce".
     */
    public String key() {
        return SkillNames.normalize(skill);
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return context.snapshot().hasTrainedSkill(skill);
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires trained in " + skill;
    }

    @Override
    public String describe() {
        return "Trained in " + skill;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.SKILL_TRAINED;
    }
}
