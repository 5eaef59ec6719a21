package com.inventoryforecast.model;

import java.time.LocalDate;

/** A dated holiday whose effect spans {@code lowerWindow..upperWindow} days around it. */
public record HolidayWindow(String name, LocalDate date, int lowerWindow, int upperWindow) {
}
