package com.animequote.domain.subtitle.model;

/**
 * One retained subtitle line.
 *
 * @param id        sequence number from the file (SRT, block position when unreadable) or a 1-based
 *                  counter (ASS); not guaranteed unique
 * @param startTime start timecode exactly as written in the file
 * @param endTime   end timecode exactly as written in the file
 * @param text      cleaned dialogue text, always containing Japanese
 */
public record DialogueEntry(
        int id,
        String startTime,
        String endTime,
        String text
) {}
