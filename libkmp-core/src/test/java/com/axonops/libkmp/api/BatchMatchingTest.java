/*
 * Copyright 2025 AxonOps
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
 */

package com.axonops.libkmp.api;

import com.axonops.libkmp.test.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for whole-text matching through {@link Pattern} and the {@link KMP} facade.
 */
class BatchMatchingTest {

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    @ParameterizedTest
    @CsvSource({
        "aaaaaa, aaa, 0 1 2 3",
        "abababab, abab, 0 2 4",
        "aaaa, aa, 0 1 2",
        "ABC ABCDAB ABCDABCDABDE, ABCDABD, 15",
        "abcabcabc, cab, 2 5",
        "needle, needle, 0"
    })
    void testKnownOffsets(String text, String pattern, String expected) {
        int[] offsets = Arrays.stream(expected.split(" ")).mapToInt(Integer::parseInt).toArray();

        MatchResult result = KMP.match(ascii(text), ascii(pattern));

        assertThat(result.offsets()).containsExactly(offsets);
        assertThat(result.count()).isEqualTo(offsets.length);
        assertThat(result.first()).isEqualTo(offsets[0]);
    }

    @Test
    void testNoOccurrence() {
        MatchResult result = KMP.match("haystack", "needle");

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.first()).isEqualTo(-1);
        assertThat(result).isEqualTo(MatchResult.empty());
    }

    @Test
    void testEmptyPatternMatchesNothing() {
        assertThat(KMP.match(ascii("abc"), new byte[0]).isEmpty()).isTrue();
        assertThat(KMP.find(ascii("abc"), new byte[0])).isEqualTo(-1);
        assertThat(KMP.contains("abc", "")).isFalse();
    }

    @Test
    void testEmptyText() {
        assertThat(KMP.match(new byte[0], ascii("a")).isEmpty()).isTrue();
        assertThat(KMP.match(new byte[0], new byte[0]).isEmpty()).isTrue();
    }

    @Test
    void testPatternLongerThanText() {
        assertThat(KMP.match("abc", "abcd").isEmpty()).isTrue();
    }

    @Test
    void testRandomTextsAgreeWithDirectComparison() {
        Random random = new Random(42);
        for (int round = 0; round < 1000; round++) {
            int alphabet = 1 + random.nextInt(3);
            byte[] pattern = TestUtils.randomBytes(random, 1 + random.nextInt(6), alphabet);
            byte[] text = TestUtils.randomBytes(random, random.nextInt(200), alphabet);

            Pattern p = Pattern.compileWithoutCache(pattern);

            assertThat(p.match(text).toList())
                .as("round %d", round)
                .isEqualTo(TestUtils.naiveOffsets(text, pattern));
        }
    }

    @Test
    void testManyMatchesGrowOutput() {
        byte[] text = new byte[10_000];
        Arrays.fill(text, (byte) 'a');

        MatchResult result = KMP.match(text, ascii("aa"));

        assertThat(result.count()).isEqualTo(9_999);
        assertThat(result.offset(0)).isZero();
        assertThat(result.offset(9_998)).isEqualTo(9_998);
    }

    @Test
    void testNegativeByteValues() {
        byte[] pattern = {(byte) 0xFF, (byte) 0x80};
        byte[] text = {0x00, (byte) 0xFF, (byte) 0x80, (byte) 0xFF, (byte) 0x80, 0x7F};

        assertThat(KMP.match(text, pattern).offsets()).containsExactly(1, 3);
    }

    @Test
    void testRangeOffsetsAreArrayIndices() {
        Pattern p = Pattern.compile("ab");
        byte[] text = ascii("abxxababab");

        assertThat(p.match(text, 4, 4).offsets()).containsExactly(4, 6);
        assertThat(p.find(text, 2, 4)).isEqualTo(4);
        // Occurrence straddling the range end is not reported
        assertThat(p.match(text, 0, 5).offsets()).containsExactly(0);
    }

    @Test
    void testInvalidRangeThrows() {
        Pattern p = Pattern.compile("ab");

        assertThatThrownBy(() -> p.match(new byte[4], 3, 2))
            .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> p.find(new byte[4], -1, 1))
            .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testHeapByteBufferOffsetsRelativeToPosition() {
        Pattern p = Pattern.compile("ab");
        ByteBuffer buffer = ByteBuffer.wrap(ascii("xxabab"));
        buffer.position(2);

        assertThat(p.match(buffer).offsets()).containsExactly(0, 2);
        assertThat(p.find(buffer)).isZero();
        assertThat(buffer.position()).isEqualTo(2);
    }

    @Test
    void testSlicedHeapByteBuffer() {
        Pattern p = Pattern.compile("ab");
        ByteBuffer buffer = ByteBuffer.wrap(ascii("zzzabab"));
        buffer.position(3);
        ByteBuffer slice = buffer.slice();

        assertThat(slice.arrayOffset()).isEqualTo(3);
        assertThat(p.match(slice).offsets()).containsExactly(0, 2);
    }

    @Test
    void testDirectByteBuffer() {
        Pattern p = Pattern.compile("aa");
        ByteBuffer buffer = ByteBuffer.allocateDirect(16);
        buffer.put(ascii("baaab"));
        buffer.flip();
        buffer.position(1);

        assertThat(p.match(buffer).offsets()).containsExactly(0, 1);
        assertThat(p.find(buffer)).isZero();
        assertThat(buffer.position()).isEqualTo(1);
        assertThat(buffer.limit()).isEqualTo(5);
    }

    @Test
    void testReadOnlyByteBuffer() {
        Pattern p = Pattern.compile("abab");
        ByteBuffer buffer = ByteBuffer.wrap(ascii("abababab")).asReadOnlyBuffer();

        assertThat(buffer.hasArray()).isFalse();
        assertThat(p.match(buffer).offsets()).containsExactly(0, 2, 4);
    }

    @Test
    void testStringOffsetsAreUtf8ByteOffsets() {
        Pattern p = Pattern.compile("llo");

        assertThat(p.match("héllo héllo").offsets()).containsExactly(3, 10);
        assertThat(p.find("héllo")).isEqualTo(3);
        assertThat(KMP.match("ééé", "éé").offsets()).containsExactly(0, 2);
    }

    @Test
    void testFindStopsAtFirstOccurrence() {
        Pattern p = Pattern.compile("aba");

        assertThat(p.find(ascii("xxabababa"))).isEqualTo(2);
        assertThat(p.find(ascii("xxxx"))).isEqualTo(-1);
        assertThat(KMP.find("ABC ABCDAB ABCDABCDABDE", "ABCDABD")).isEqualTo(15);
    }

    @Test
    void testContainsAndCount() {
        Pattern p = Pattern.compile("aa");

        assertThat(p.contains("baab")).isTrue();
        assertThat(p.contains(ascii("abab"))).isFalse();
        assertThat(p.count(ascii("aaaa"))).isEqualTo(3);
        assertThat(KMP.contains(ascii("xaax"), ascii("aa"))).isTrue();
    }

    @Test
    void testRepeatedCallsAreDeterministic() {
        Pattern p = Pattern.compile("abab");
        byte[] text = ascii("abababxabab");

        MatchResult first = p.match(text);
        MatchResult second = p.match(text);

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first.toString()).isEqualTo("MatchResult[0, 2, 7]");
    }

    @Test
    void testPatternUnaffectedByCallerMutation() {
        byte[] pattern = ascii("ab");
        Pattern p = Pattern.compileWithoutCache(pattern);

        pattern[0] = 'x';

        assertThat(p.match(ascii("abab")).offsets()).containsExactly(0, 2);
        assertThat(p.bytes()).isEqualTo(ascii("ab"));
    }

    @Test
    void testResultAccessorsReturnCopies() {
        MatchResult result = KMP.match("aaa", "a");

        result.offsets()[0] = 99;

        assertThat(result.offset(0)).isZero();
        assertThat(result.stream().sum()).isEqualTo(3);
        assertThat(result.toList()).containsExactly(0, 1, 2);
        assertThatThrownBy(() -> result.toList().add(5))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.offset(3))
            .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testNullArgumentsThrow() {
        Pattern p = Pattern.compile("a");

        assertThatThrownBy(() -> p.match((byte[]) null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> p.match((ByteBuffer) null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> p.find((String) null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Pattern.compile((String) null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testFacadeBuildsFailureTable() {
        FailureTable table = KMP.buildFailureTable(ascii("ababaca"));

        assertThat(table.toArray()).containsExactly(-1, -1, 0, 1, 2, -1, 0);
        assertThat(KMP.compile("ababaca").failureTable()).isEqualTo(table);
    }
}
