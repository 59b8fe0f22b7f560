package io.kitchensync.core.run;

public record ProcessingSummary(int processed, int succeeded, int failed, int cancelled) {

    public static ProcessingSummary empty() {
        return new ProcessingSummary(0, 0, 0, 0);
    }
}
