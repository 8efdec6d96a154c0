package com.verlumen.islandgp.regression;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.islandgp.config.GpConfig;
import com.verlumen.islandgp.evolution.EvolutionModule;
import com.verlumen.islandgp.evolution.GeneticProgramming;
import com.verlumen.islandgp.evolution.RunResult;
import com.verlumen.islandgp.population.Individual;
import io.jenetics.prog.op.MathOp;
import io.jenetics.prog.op.Op;
import java.util.Locale;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Command-line symbolic regression: evolves a program mapping the given input tuples to the given
 * outputs and logs the best one found.
 *
 * <pre>
 *   App --symbols x --inputs "1;2;3" --outputs "2,4,6" --functions add,mul
 * </pre>
 */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter TUPLE_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();

  private final GeneticProgramming geneticProgramming;

  @Inject
  App(GeneticProgramming geneticProgramming) {
    this.geneticProgramming = geneticProgramming;
  }

  RunResult run(GpConfig config) {
    logger.atInfo().log(
        "Searching for a program over %s with %s", config.symbols(), functionNames(config));
    RunResult result = geneticProgramming.runGp(config);
    if (result.best().isPresent()) {
      Individual best = result.best().get();
      logger.atInfo().log(
          "Best program: %s (fitness %s)", best.tree(), best.fitness().getAsDouble());
    } else {
      logger.atWarning().log("No generation ran; increase --gens or --cycles");
    }
    return result;
  }

  public static void main(String[] args) {
    ArgumentParser parser = createArgumentParser();
    GpConfig config;
    try {
      config = parse(parser, args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      System.exit(1);
      return;
    }
    try (GeneticProgramming geneticProgramming =
        Guice.createInjector(EvolutionModule.create()).getInstance(GeneticProgramming.class)) {
      new App(geneticProgramming).run(config);
    }
  }

  static GpConfig parseConfig(String... args) throws ArgumentParserException {
    return parse(createArgumentParser(), args);
  }

  /** Parses {@code args}; malformed values and invalid settings surface as parser errors. */
  private static GpConfig parse(ArgumentParser parser, String... args)
      throws ArgumentParserException {
    Namespace namespace = parser.parseArgs(args);
    try {
      return toConfig(namespace);
    } catch (IllegalArgumentException e) {
      throw new ArgumentParserException(e.getMessage(), e, parser);
    }
  }

  private static GpConfig toConfig(Namespace namespace) {
    GpConfig.Builder builder =
        GpConfig.builder()
            .symbols(ImmutableList.copyOf(LIST_SPLITTER.split(namespace.getString("symbols"))))
            .functions(parseFunctions(namespace.getString("functions")))
            .tests(parseTuples(namespace.getString("inputs")))
            .expected(parseValues(namespace.getString("outputs")))
            .termMin(namespace.getInt("termMin"))
            .termMax(namespace.getInt("termMax"))
            .depthMin(namespace.getInt("depthMin"))
            .depthMax(namespace.getInt("depthMax"))
            .mutationRate(namespace.getDouble("mutationRate"))
            .tournamentSize(namespace.getInt("tournamentSize"))
            .forestSize(namespace.getInt("forestSize"))
            .popSize(namespace.getInt("popSize"))
            .generations(namespace.getInt("gens"))
            .cycles(namespace.getInt("cycles"))
            .reportRate(namespace.getInt("reportRate"));
    Long seed = namespace.getLong("seed");
    if (seed != null) {
      builder.seed(seed);
    }
    return builder.build();
  }

  private static ImmutableList<Op<Double>> parseFunctions(String names) {
    ImmutableList.Builder<Op<Double>> functions = ImmutableList.builder();
    for (String name : LIST_SPLITTER.split(names)) {
      try {
        functions.add(MathOp.valueOf(name.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown function: " + name, e);
      }
    }
    return functions.build();
  }

  private static ImmutableList<ImmutableList<Double>> parseTuples(String tuples) {
    return TUPLE_SPLITTER.splitToStream(tuples).map(App::parseValues).collect(toImmutableList());
  }

  private static ImmutableList<Double> parseValues(String values) {
    return LIST_SPLITTER.splitToStream(values).map(Double::valueOf).collect(toImmutableList());
  }

  private static ImmutableList<String> functionNames(GpConfig config) {
    return config.functions().stream().map(Op::name).collect(toImmutableList());
  }

  private static ArgumentParser createArgumentParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("IslandGpRegression")
            .build()
            .defaultHelp(true)
            .description("Evolve a program that fits input/output examples");

    parser.addArgument("--symbols").setDefault("x").help("Comma-separated input symbols");

    parser.addArgument("--inputs")
        .required(true)
        .help("Input tuples separated by ';', values within a tuple separated by ','");

    parser.addArgument("--outputs")
        .required(true)
        .help("Comma-separated expected outputs, one per input tuple");

    parser.addArgument("--functions")
        .setDefault("add,sub,mul")
        .help("Comma-separated operator names (Jenetics MathOp constants)");

    parser.addArgument("--termMin").type(Integer.class).setDefault(-1).help("Smallest constant");

    parser.addArgument("--termMax")
        .type(Integer.class)
        .setDefault(1)
        .help("Exclusive upper bound for constants");

    parser.addArgument("--depthMin").type(Integer.class).setDefault(2).help("Minimum tree depth");

    parser.addArgument("--depthMax").type(Integer.class).setDefault(4).help("Maximum tree depth");

    parser.addArgument("--mutationRate")
        .type(Double.class)
        .setDefault(0.05)
        .help("Per-individual mutation probability");

    parser.addArgument("--tournamentSize")
        .type(Integer.class)
        .setDefault(5)
        .help("Individuals sampled per tournament");

    parser.addArgument("--forestSize")
        .type(Integer.class)
        .setDefault(50)
        .help("Individuals per island");

    parser.addArgument("--popSize").type(Integer.class).setDefault(4).help("Number of islands");

    parser.addArgument("--gens")
        .type(Integer.class)
        .setDefault(20)
        .help("Generations per island per cycle");

    parser.addArgument("--cycles")
        .type(Integer.class)
        .setDefault(10)
        .help("Migration cycles");

    parser.addArgument("--reportRate")
        .type(Integer.class)
        .setDefault(1)
        .help("Reporting interval control");

    parser.addArgument("--seed").type(Long.class).help("Random seed for reproducible runs");

    return parser;
  }
}
