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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ClockTest {

    @Test
    public void testSimpleClock() {
        long start = System.currentTimeMillis();
        long time = Clock.SIMPLE.getTime();
        assertTrue(time >= start);
    }

    @Test
    public void testVirtualClockIsStrictlyIncreasing() {
        Clock clock = new Clock.Virtual(10);
        assertEquals(10, clock.getTime());
        assertEquals(11, clock.getTime());
        assertEquals(12, clock.getTimeMonotonic());
    }

    @Test
    public void testMonotonicNeverGoesBack() {
        final long[] readings = {5, 3, 8};
        Clock clock = new Clock() {
            int i = 0;

            @Override
            public long getTime() {
                return readings[i++];
            }
        };
        assertEquals(5, clock.getTimeMonotonic());
        assertEquals(5, clock.getTimeMonotonic());
        assertEquals(8, clock.getTimeMonotonic());
    }
}
