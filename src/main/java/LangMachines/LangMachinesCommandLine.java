package LangMachines;

import LangMachines.IO.DotRenderer;
import LangMachines.IO.DotWriter;
import LangMachines.IO.JsonFormat;
import LangMachines.IO.RendererUnavailableException;
import LangMachines.Model.DFA;
import LangMachines.Model.NFA;
import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class LangMachinesCommandLine {
  public static void main(String[] args) {
    String jsonOut = null;
    String dotOut = null;
    String renderFormat = null;
    String renderOut = null;
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        Determinization.DEBUG = true;
      } else if ("--writeJSON".equalsIgnoreCase(arg)) {
        jsonOut = requireValue(args, i++, arg);
      } else if ("--writeDOT".equalsIgnoreCase(arg)) {
        dotOut = requireValue(args, i++, arg);
      } else if ("--render".equalsIgnoreCase(arg)) {
        renderFormat = requireValue(args, i++, arg);
        renderOut = requireValue(args, i++, arg);
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    boolean validInvocation = (positional.size() == 2);
    if (!validInvocation) {
      printUsageAndExit();
    }

    String algorithm = positional.get(0);
    String filePath  = positional.get(1);

    final JSONObject input = readInput(filePath);
    System.out.println("Input " + input.optString(JsonFormat.TYPE) + " size: " + input.getJSONArray(JsonFormat.STATES).length());
    System.out.println("Alphabet size: " + input.getJSONArray(JsonFormat.ALPHABET).length());

    long before = System.currentTimeMillis();
    DFA<String, String> result = allAlgorithms(algorithm, input);
    long after = System.currentTimeMillis();
    System.out.println(algorithm + " DFA size: " + result.size());
    System.out.println(algorithm + " duration: " + ((after - before) / 1000f) + "s");

    writeOutputs(result, jsonOut, dotOut, renderFormat, renderOut);
  }

  // Require a value that isn't another flag
  private static String requireValue(String[] args, int flagIndex, String flag) {
    if (flagIndex + 1 >= args.length || args[flagIndex + 1].startsWith("-")) {
      System.err.println("Missing value for " + flag);
      printUsageAndExit(); // exits
    }
    return args[flagIndex + 1];
  }

  private static void printUsageAndExit() {
    System.out.println(
        "LangMachines [--debug] [--writeJSON <file>] [--writeDOT <file>] [--render <format> <file>] <algorithm> <JSON input file>");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--writeJSON <file>] : Write the resulting DFA as JSON");
    System.out.println("[--writeDOT <file>] : Write the resulting DFA as Graphviz DOT text");
    System.out.println("[--render <format> <file>] : Render the resulting DFA with Graphviz, e.g. png or svg");
    System.out.println();
    System.out.println("<algorithm> : one of the choices below:");
    System.out.println("  det: Subset construction of an NFA.");
    System.out.println("  min: Hopcroft minimization of a DFA.");
    System.out.println("  det-min: Subset construction of an NFA, then Hopcroft minimization.");
    System.out.println("  prune: Remove the states of a DFA that are unreachable from its start state.");
    System.out.println("  total: Complete the transition function of a DFA with a sink state.");
    System.out.println();
    System.out.println("<JSON input file> : automaton record with \"type\": \"dfa\" or \"nfa\".");
    System.exit(0);
  }

  private static JSONObject readInput(String filePath) {
    try {
      return JsonFormat.readJson(Paths.get(filePath));
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * Choose algorithm to run.
   * @param algorithm - algorithm passed in from command-line
   * @param input - automaton record, an NFA for det and det-min, a DFA otherwise
   * @return - resulting DFA
   */
  static DFA<String, String> allAlgorithms(String algorithm, JSONObject input) {
    System.out.println();
    System.out.println("Invoking algorithm:" + algorithm);
    return switch (algorithm.toLowerCase()) {
      case "det" -> det(JsonFormat.nfaFromJson(input));
      case "min" -> HopcroftMinimization.minimizeDFA(JsonFormat.dfaFromJson(input));
      case "det-min" -> detMin(JsonFormat.nfaFromJson(input));
      case "prune" -> AutomatonTrim.pruneUnreachable(JsonFormat.dfaFromJson(input));
      case "total" -> AutomatonTrim.totalize(JsonFormat.dfaFromJson(input));
      default -> throw new IllegalStateException("Unexpected algorithm choice: " + algorithm);
    };
  }

  private static DFA<String, String> det(NFA<String, String> nfa) {
    int prevSize = nfa.size();
    nfa = AutomatonTrim.pruneUnreachable(nfa);
    if (nfa.size() < prevSize) {
      System.out.println("Pruned to: " + nfa.size());
    }
    return Determinization.toDFA(nfa);
  }

  private static DFA<String, String> detMin(NFA<String, String> nfa) {
    long before = System.currentTimeMillis();
    DFA<String, String> dfa = det(nfa);
    long after = System.currentTimeMillis();
    System.out.println("Unminimized SC DFA size: " + dfa.size());
    System.out.println("SC duration: " + ((after - before) / 1000f) + "s");
    return HopcroftMinimization.minimizeDFA(dfa);
  }

  private static void writeOutputs(DFA<String, String> dfa, String jsonOut, String dotOut, String renderFormat, String renderOut) {
    try {
      if (jsonOut != null) {
        System.out.println("Writing JSON to file: " + jsonOut);
        JsonFormat.saveDFA(dfa, Paths.get(jsonOut));
      }
      if (dotOut != null) {
        System.out.println("Writing DOT to file: " + dotOut);
        Files.writeString(Path.of(dotOut), DotWriter.dfaToDot(dfa) + "\n", StandardCharsets.UTF_8);
      }
      if (renderFormat != null) {
        System.out.println("Rendering " + renderFormat + " to file: " + renderOut);
        DotRenderer.render(dfa, renderFormat, new File(renderOut));
      }
    } catch (RendererUnavailableException e) {
      System.err.println("Rendering skipped: " + e.getMessage());
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
