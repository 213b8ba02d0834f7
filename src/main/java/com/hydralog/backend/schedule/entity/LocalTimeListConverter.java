package com.hydralog.backend.schedule.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** "08:00,20:00" in the column. */
@Converter(autoApply = false)
public class LocalTimeListConverter implements AttributeConverter<List<LocalTime>, String> {
    private static final DateTimeFormatter HM = DateTimeFormatter.ofPattern("HH:mm");

    @Override
    public String convertToDatabaseColumn(List<LocalTime> times) {
        if (times == null || times.isEmpty()) return "";
        return times.stream().map(HM::format).collect(Collectors.joining(","));
    }

    @Override
    public List<LocalTime> convertToEntityAttribute(String s) {
        if (s == null || s.isBlank()) return List.of();
        return Arrays.stream(s.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .map(v -> LocalTime.parse(v, HM))
                .toList();
    }
}
