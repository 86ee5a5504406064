package net.chapterone.service.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.chapterone.domain.context.ReadingContext;
import net.chapterone.util.ValidationUtils;

/**
 * Descriptive keywords for reading contexts, matched against book tags and text.
 */
final class ContextKeywords {

    private static final Map<String, List<String>> MOOD_KEYWORDS = Map.ofEntries(
        Map.entry("curious", List.of("learn", "discover", "explore", "knowledge", "science", "mystery")),
        Map.entry("relaxed", List.of("calm", "peaceful", "gentle", "soothing", "meditation", "nature")),
        Map.entry("focused", List.of("productivity", "goals", "achievement", "business", "strategy", "success")),
        Map.entry("adventurous", List.of("adventure", "travel", "exploration", "journey", "quest", "excitement")),
        Map.entry("contemplative", List.of("philosophy", "wisdom", "reflection", "spiritual", "meaning")),
        Map.entry("energetic", List.of("action", "dynamic", "thriller", "excitement", "intense")),
        Map.entry("motivated", List.of("inspiring", "uplifting", "success", "habits", "achievement")),
        Map.entry("nostalgic", List.of("memoir", "history", "classic", "sentimental", "reflective")),
        Map.entry("excited", List.of("thrilling", "exciting", "bold", "adventure")),
        Map.entry("peaceful", List.of("calm", "gentle", "nature", "poetry", "mindfulness")),
        Map.entry("inspired", List.of("inspiration", "creativity", "biography", "uplifting")),
        Map.entry("thoughtful", List.of("essays", "philosophy", "society", "ideas", "reflective"))
    );

    private static final Map<String, List<String>> GOAL_KEYWORDS = Map.ofEntries(
        Map.entry("learning", List.of("education", "learning", "knowledge", "skill", "guide")),
        Map.entry("relaxation", List.of("relaxation", "calm", "peaceful", "gentle")),
        Map.entry("entertainment", List.of("entertainment", "fun", "humor", "comedy", "captivating")),
        Map.entry("inspiration", List.of("inspiration", "motivation", "success", "uplifting")),
        Map.entry("perspective", List.of("psychology", "relationships", "empathy", "society", "culture")),
        Map.entry("professional", List.of("career", "leadership", "management", "business")),
        Map.entry("skill_building", List.of("skill", "practice", "guide", "craft")),
        Map.entry("escape", List.of("fantasy", "adventure", "escapist", "immersive")),
        Map.entry("self_improvement", List.of("habits", "growth", "psychology", "motivation")),
        Map.entry("creativity", List.of("creativity", "art", "design", "writing")),
        Map.entry("productivity", List.of("productivity", "focus", "habits", "time")),
        Map.entry("mindfulness", List.of("mindfulness", "meditation", "calm", "presence"))
    );

    private static final Map<String, List<String>> SITUATION_KEYWORDS = Map.ofEntries(
        Map.entry("commuting", List.of("short", "engaging", "stories")),
        Map.entry("traveling", List.of("engaging", "escapist", "travel")),
        Map.entry("before_bed", List.of("calming", "peaceful", "light")),
        Map.entry("lunch_break", List.of("short", "inspiring", "essays")),
        Map.entry("studying", List.of("reference", "textbook", "learning")),
        Map.entry("work_day", List.of("productivity", "professional", "skills")),
        Map.entry("weekend", List.of("immersive", "novel", "epic")),
        Map.entry("vacation", List.of("immersive", "adventure", "beach"))
    );

    private ContextKeywords() {
    }

    /** Keywords for the recognised parts of the context, mood first. */
    static List<String> keywordsFor(ReadingContext context) {
        List<String> keywords = new ArrayList<>();
        if (context == null) {
            return keywords;
        }
        keywords.addAll(MOOD_KEYWORDS.getOrDefault(ValidationUtils.normalizeKey(context.mood()), List.of()));
        keywords.addAll(GOAL_KEYWORDS.getOrDefault(ValidationUtils.normalizeKey(context.goal()), List.of()));
        keywords.addAll(SITUATION_KEYWORDS.getOrDefault(ValidationUtils.normalizeKey(context.situation()), List.of()));
        return keywords;
    }

    /**
     * Free-text rendering of the context for the TF-IDF query: the raw values plus their keywords.
     */
    static String queryText(ReadingContext context) {
        if (context == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (String value : new String[] {context.mood(), context.situation(), context.goal()}) {
            String key = ValidationUtils.normalizeKey(value);
            if (key != null) {
                text.append(key.replace('_', ' ')).append(' ');
            }
        }
        text.append(String.join(" ", keywordsFor(context)));
        return text.toString().trim();
    }
}
