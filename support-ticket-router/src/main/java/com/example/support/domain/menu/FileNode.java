package com.example.support.domain.menu;

public record FileNode(String label, String file, String caption) implements MenuNode {}
