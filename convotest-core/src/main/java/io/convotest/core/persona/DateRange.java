package io.convotest.core.persona;

import java.time.LocalDate;

public record DateRange(LocalDate start, LocalDate end) {
}
