/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.quill.commons.time;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of millisecond timestamps for history entries.
 */
public abstract class Clock {

    private long monotonic = 0;

    /**
     * Returns the current time in milliseconds since the epoch.
     *
     * @see System#currentTimeMillis()
     */
    public abstract long getTime();

    /**
     * Returns a timestamp that is greater than or equal to any value
     * previously returned by this method, even if the underlying time is
     * adjusted backwards.
     */
    public synchronized long getTimeMonotonic() {
        long now = getTime();
        if (now > monotonic) {
            monotonic = now;
        } else {
            now = monotonic;
        }
        return now;
    }

    /**
     * Clock based on {@link System#currentTimeMillis()}.
     */
    public static final Clock SIMPLE = new Clock() {
        @Override
        public long getTime() {
            return System.currentTimeMillis();
        }

        @Override
        public String toString() {
            return "Clock.SIMPLE";
        }
    };

    /**
     * A clock with no connection to the system time. Each reading returns
     * the next value of an internal counter, so readings are strictly
     * increasing and reproducible.
     */
    public static class Virtual extends Clock {

        private final AtomicLong time;

        public Virtual() {
            this(0);
        }

        public Virtual(long start) {
            this.time = new AtomicLong(start);
        }

        @Override
        public long getTime() {
            return time.getAndIncrement();
        }

        @Override
        public String toString() {
            return "Clock.Virtual";
        }
    }
}
