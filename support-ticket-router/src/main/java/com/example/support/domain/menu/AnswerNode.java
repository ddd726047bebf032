package com.example.support.domain.menu;

public record AnswerNode(String label, String answer) implements MenuNode {}
