package com.example.support.domain.menu;

public record LinkNode(String label, String url) implements MenuNode {}
