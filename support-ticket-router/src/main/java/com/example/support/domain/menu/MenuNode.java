package com.example.support.domain.menu;

/**
 * One entry of the FAQ menu tree. Every node renders as a button with its label.
 */
public interface MenuNode {

    String label();
}
