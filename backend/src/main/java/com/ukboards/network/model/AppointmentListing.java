package com.ukboards.network.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public record AppointmentListing(List<Appointment> items, JsonNode raw) {

    public static AppointmentListing fromJson(JsonNode json) {
        List<Appointment> items = new ArrayList<>();
        for (JsonNode item : json.path("items")) {
            items.add(Appointment.fromJson(item));
        }
        return new AppointmentListing(List.copyOf(items), json);
    }

    public boolean hasItems() {
        return raw != null && raw.has("items");
    }
}
