package me.golemcore.ircbot.module.api;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Trigger regex that can be swapped while the trigger stays registered. The
 * module that declared the trigger and the registry entry share one instance.
 */
public final class SharedPattern {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Pattern pattern;

    public SharedPattern(Pattern pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    /**
     * Compiles {@code regex} case-insensitively.
     *
     * @throws java.util.regex.PatternSyntaxException
     *             if the regex is invalid
     */
    public static SharedPattern compile(String regex) {
        return new SharedPattern(Pattern.compile(regex, FLAGS));
    }

    public Pattern get() {
        lock.readLock().lock();
        try {
            return pattern;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void set(Pattern newPattern) {
        Objects.requireNonNull(newPattern, "newPattern");
        lock.writeLock().lock();
        try {
            this.pattern = newPattern;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void set(String regex) {
        set(Pattern.compile(regex, FLAGS));
    }

    /**
     * Searches {@code text} anywhere, not only at its start.
     */
    public Optional<MatchResult> match(CharSequence text) {
        Matcher matcher = get().matcher(text);
        return matcher.find() ? Optional.of(matcher.toMatchResult()) : Optional.empty();
    }

    @Override
    public String toString() {
        return get().pattern();
    }
}
