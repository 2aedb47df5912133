package com.quill.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PasswordHasher")
class PasswordHasherTest {

    private PasswordHasher hasher;

    @BeforeEach
    void setUp() {
        hasher = new PasswordHasher(PasswordHasher.MIN_STRENGTH);
    }

    @Nested
    @DisplayName("hash()")
    class Hash {

        @Test
        @DisplayName("produces a BCrypt record at the configured cost")
        void producesBcryptRecord() {
            HashRecord record = hasher.hash("Sup3rSecret");

            assertThat(record.encoded()).startsWith("$2a$04$").doesNotContain("Sup3rSecret");
            assertThat(record.cost()).isEqualTo(4);
        }

        @Test
        @DisplayName("salts every hash, so equal passwords give different records")
        void salted() {
            assertThat(hasher.hash("Sup3rSecret")).isNotEqualTo(hasher.hash("Sup3rSecret"));
        }

        @Test
        @DisplayName("rejects a null password")
        void rejectsNull() {
            assertThatThrownBy(() -> hasher.hash(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("byte limit")
    class ByteLimit {

        /** 3 + 2 * 34 + 1 = 72 UTF-8 bytes. */
        private final String longest = "Aa1" + "\u00e9".repeat(34) + "x";

        @Test
        @DisplayName("measures length in UTF-8 bytes, not characters")
        void countsBytes() {
            assertThat(PasswordHasher.withinLength(longest)).isTrue();
            assertThat(PasswordHasher.withinLength(longest + "x")).isFalse();
            assertThat(PasswordHasher.withinLength("Aa1" + "\u00e9".repeat(60))).isFalse();
        }

        @Test
        @DisplayName("refuses to hash a password BCrypt would truncate")
        void rejectsOverLongHash() {
            assertThatThrownBy(() -> hasher.hash("Aa1" + "\u00e9".repeat(60)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("72");
        }

        @Test
        @DisplayName("a password sharing the first 72 bytes of a stored one does not verify")
        void sharedPrefixDoesNotVerify() {
            HashRecord record = hasher.hash(longest);

            assertThat(hasher.verify(longest, record)).isTrue();
            assertThat(hasher.verify(longest + "TOTALLYDIFFERENT", record)).isFalse();
        }
    }

    @Nested
    @DisplayName("verify()")
    class Verify {

        @Test
        @DisplayName("accepts the original password and rejects any other")
        void matchesOnlyOriginal() {
            HashRecord record = hasher.hash("Sup3rSecret");

            assertThat(hasher.verify("Sup3rSecret", record)).isTrue();
            assertThat(hasher.verify("sup3rsecret", record)).isFalse();
            assertThat(hasher.verify("", record)).isFalse();
        }

        @Test
        @DisplayName("returns false instead of throwing on null input or a malformed record")
        void neverThrows() {
            HashRecord record = hasher.hash("Sup3rSecret");

            assertThat(hasher.verify(null, record)).isFalse();
            assertThat(hasher.verify("Sup3rSecret", null)).isFalse();
            assertThat(hasher.verify("Sup3rSecret", new HashRecord("not-a-bcrypt-hash"))).isFalse();
        }

        @Test
        @DisplayName("keeps verifying records created under a different cost")
        void costChangeKeepsOldRecords() {
            HashRecord old = hasher.hash("Sup3rSecret");
            PasswordHasher stronger = new PasswordHasher(5);

            assertThat(stronger.verify("Sup3rSecret", old)).isTrue();
        }
    }

    @Nested
    @DisplayName("needsRehash()")
    class NeedsRehash {

        @Test
        @DisplayName("is true only for records weaker than the configured cost")
        void comparesCost() {
            HashRecord weak = hasher.hash("Sup3rSecret");
            PasswordHasher stronger = new PasswordHasher(5);

            assertThat(stronger.needsRehash(weak)).isTrue();
            assertThat(hasher.needsRehash(weak)).isFalse();
            assertThat(hasher.needsRehash(stronger.hash("Sup3rSecret"))).isFalse();
        }

        @Test
        @DisplayName("ignores records that are not in BCrypt form")
        void ignoresForeignRecords() {
            assertThat(hasher.needsRehash(new HashRecord("plain"))).isFalse();
        }
    }

    @Test
    @DisplayName("rejects a strength outside BCrypt's range")
    void rejectsBadStrength() {
        assertThatThrownBy(() -> new PasswordHasher(3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 4 and 31");
        assertThatThrownBy(() -> new PasswordHasher(32))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
