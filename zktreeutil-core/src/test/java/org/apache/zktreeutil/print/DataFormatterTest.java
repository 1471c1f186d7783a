/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.zktreeutil.print;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.apache.zktreeutil.ZkTreeUtilTestCase;
import org.junit.jupiter.api.Test;

public class DataFormatterTest extends ZkTreeUtilTestCase {

    private static final byte[] TEXT = "hello\tworld\n".getBytes(UTF_8);
    private static final byte[] BINARY = {0, 1, 2, (byte) 0xff};

    @Test
    public void testPlain() {
        assertEquals("hello\tworld\n", PlainDataFormatter.INSTANCE.format(TEXT));
    }

    @Test
    public void testBase64() {
        assertEquals("AAEC/w==", Base64DataFormatter.INSTANCE.format(BINARY));
    }

    @Test
    public void testHexDump() {
        String dump = HexDumpDataFormatter.INSTANCE.format("abc".getBytes(UTF_8));
        assertThat(dump, containsString("|00000000| 61 62 63"));
        assertThat(dump, containsString("|abc"));
    }

    @Test
    public void testAuto() {
        assertEquals("hello\tworld\n", AutoDataFormatter.INSTANCE.format(TEXT));
        assertEquals("AAEC/w==", AutoDataFormatter.INSTANCE.format(BINARY));
        assertEquals("gr\u00fc\u00df", AutoDataFormatter.INSTANCE.format("gr\u00fc\u00df".getBytes(UTF_8)));
        // valid UTF-8 but with a control character
        assertEquals("YQdi", AutoDataFormatter.INSTANCE.format("a\u0007b".getBytes(UTF_8)));
    }

    @Test
    public void testForName() {
        assertSame(PlainDataFormatter.INSTANCE, DataFormatter.forName("plain"));
        assertSame(Base64DataFormatter.INSTANCE, DataFormatter.forName("BASE64"));
        assertSame(HexDumpDataFormatter.INSTANCE, DataFormatter.forName(" hex "));
        assertSame(AutoDataFormatter.INSTANCE, DataFormatter.forName("auto"));
        assertThrows(IllegalArgumentException.class, () -> DataFormatter.forName("octal"));
    }

}
