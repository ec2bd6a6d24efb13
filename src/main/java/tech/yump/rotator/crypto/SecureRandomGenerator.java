package tech.yump.rotator.crypto;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.List;

/**
 * Generates random strings for passwords and other rotated secrets.
 * Backed by a single {@link SecureRandom}; every call is an independent draw.
 */
@Slf4j
@Component
public class SecureRandomGenerator {

    public static final int DEFAULT_LENGTH = 32;

    private final SecureRandom random;

    public SecureRandomGenerator() {
        this(new SecureRandom());
    }

    SecureRandomGenerator(SecureRandom random) {
        this.random = random;
    }

    /**
     * Generates an alphanumeric string.
     *
     * @param length number of characters, at least 1.
     */
    public String generate(int length) {
        return generate(length, CharacterSet.ALPHANUMERIC);
    }

    /**
     * Generates a random string over the given character set.
     * When {@code length} is at least the number of character classes of the set, the
     * result holds one character of each class; the buffer is then shuffled.
     *
     * @param length       number of characters, at least 1.
     * @param characterSet the alphabet to draw from.
     * @return the generated string.
     * @throws IllegalArgumentException if length is less than 1.
     */
    public String generate(int length, CharacterSet characterSet) {
        if (length < 1) {
            throw new IllegalArgumentException("Random length must be at least 1, got " + length);
        }
        if (characterSet == null) {
            characterSet = CharacterSet.ALPHANUMERIC;
        }

        List<String> classes = characterSet.classes();
        String alphabet = characterSet.alphabet();
        char[] buffer = new char[length];
        int position = 0;

        if (length >= classes.size()) {
            for (String characterClass : classes) {
                buffer[position++] = pick(characterClass);
            }
        }
        while (position < length) {
            buffer[position++] = pick(alphabet);
        }
        shuffle(buffer);

        log.trace("Generated random value of length {} over charset '{}'", length, characterSet.value());
        return new String(buffer);
    }

    private char pick(String source) {
        return source.charAt(random.nextInt(source.length()));
    }

    // Fisher-Yates
    private void shuffle(char[] buffer) {
        for (int i = buffer.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            char tmp = buffer[i];
            buffer[i] = buffer[j];
            buffer[j] = tmp;
        }
    }
}
