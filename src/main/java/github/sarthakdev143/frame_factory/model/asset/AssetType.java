package github.sarthakdev143.frame_factory.model.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AssetType {
    AUDIO,
    VIDEO;

    @JsonCreator
    public static AssetType fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("asset type is required.");
        }

        try {
            return AssetType.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("asset type must be one of audio, video.");
        }
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
