package com.scholary.songscraper.api;

/** Value for the field the session currently expects. Checked by the session manager. */
public record SessionFieldRequest(String value) {}
