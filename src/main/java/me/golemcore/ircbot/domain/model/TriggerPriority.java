package me.golemcore.ircbot.domain.model;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Priority bucket of a trigger. Buckets are scanned from {@link #MAXIMUM} down
 * to {@link #MINIMUM}.
 */
public enum TriggerPriority {
    MINIMUM,
    LOW,
    MEDIUM,
    HIGH,
    MAXIMUM;

    private static final List<TriggerPriority> DESCENDING;

    static {
        List<TriggerPriority> values = new ArrayList<>(Arrays.asList(values()));
        Collections.reverse(values);
        DESCENDING = List.copyOf(values);
    }

    public static List<TriggerPriority> descending() {
        return DESCENDING;
    }
}
