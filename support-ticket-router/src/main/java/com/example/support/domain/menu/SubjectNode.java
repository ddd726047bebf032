package com.example.support.domain.menu;

/**
 * Picks a ticket category directly from the menu and moves the conversation to description entry.
 */
public record SubjectNode(String label, String subject, String answer) implements MenuNode {}
