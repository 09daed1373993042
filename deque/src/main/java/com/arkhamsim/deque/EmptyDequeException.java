package com.arkhamsim.deque;

import java.util.NoSuchElementException;

public final class EmptyDequeException extends NoSuchElementException {
    public EmptyDequeException(String message) { super(message); }
}
