package com.wom.openings.model;

public record GeoPoint(double lat, double lon) {}
