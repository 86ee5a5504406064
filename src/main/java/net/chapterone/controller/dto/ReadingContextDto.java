package net.chapterone.controller.dto;

import net.chapterone.domain.context.ReadingContext;

/** Reading context as sent by clients; every field optional. */
public record ReadingContextDto(String mood, String situation, String goal, String timeOfDay, Integer dayOfWeek) {

    public ReadingContext toDomain() {
        return new ReadingContext(mood, situation, goal, timeOfDay, dayOfWeek);
    }
}
