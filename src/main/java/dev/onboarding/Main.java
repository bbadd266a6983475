package dev.onboarding;

import dev.onboarding.cli.OnboardingAnalysisCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new OnboardingAnalysisCli()).execute(args);
        System.exit(exitCode);
    }
}
