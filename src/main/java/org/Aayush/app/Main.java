package org.Aayush.app;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.assignment.core.AssignmentException;
import org.Aayush.assignment.dispatch.DispatchPlanner;
import org.Aayush.assignment.dispatch.DispatchRequest;
import org.Aayush.assignment.dispatch.DispatchResult;
import org.Aayush.assignment.dispatch.DriverAssignment;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point: reads an addresses file and a drivers file, one entry
 * per line, and prints the optimal driver/destination pairing.
 *
 * <p>Usage: {@code Main <addresses-file> <drivers-file>}. Missing paths are
 * prompted for on standard input.</p>
 */
@Slf4j
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    /**
     * Launches the dispatch CLI.
     *
     * @param args optional addresses path and drivers path.
     */
    public static void main(String[] args) {
        int status = run(args, System.in, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs the CLI against explicit streams.
     *
     * @return process exit status.
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        BufferedReader prompt = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            String addressesPath = args.length > 0 ? args[0] : ask(prompt, out, "Enter path to addresses file:");
            String driversPath = args.length > 1 ? args[1] : ask(prompt, out, "Enter path to drivers file:");

            DispatchRequest request = DispatchRequest.builder()
                    .addresses(readLines(Path.of(addressesPath)))
                    .drivers(readLines(Path.of(driversPath)))
                    .build();
            print(new DispatchPlanner().plan(request), out);
            return EXIT_OK;
        } catch (IOException ex) {
            log.debug("Failed to read input files", ex);
            err.println(ex + ": Data text files required.");
            return EXIT_FAILURE;
        } catch (AssignmentException ex) {
            err.println(ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Reads non-blank, trimmed lines from a UTF-8 text file.
     */
    static List<String> readLines(Path path) throws IOException {
        List<String> lines = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    private static String ask(BufferedReader prompt, PrintStream out, String question) throws IOException {
        out.println(question);
        String answer = prompt.readLine();
        if (answer == null || answer.isBlank()) {
            throw new IOException("No path entered for: " + question);
        }
        return answer.trim();
    }

    private static void print(DispatchResult result, PrintStream out) {
        out.println("total score: " + result.getTotalSuitabilityScore());
        out.println("assignments:");
        for (DriverAssignment assignment : result.getAssignments()) {
            out.println("\tDriver: " + assignment.getDriver());
            out.println("\tDestination: " + assignment.getAddress());
            out.println();
        }
        for (String driver : result.getUnmatchedDrivers()) {
            out.println("unassigned driver: " + driver);
        }
        for (String address : result.getUnmatchedAddresses()) {
            out.println("unassigned destination: " + address);
        }
    }
}
