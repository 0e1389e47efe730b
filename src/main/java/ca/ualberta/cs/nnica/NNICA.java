/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ca.ualberta.cs.nnica;

import ca.ualberta.cs.nnica.gradient.*;
import org.apache.commons.cli.*;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

import java.io.*;
import java.text.DecimalFormat;
import java.util.Date;

/**
 * Command line entry point: reads a data file, separates it and writes sources and mixing matrix.
 */
public class NNICA {

    public static IcaResult separateFile(DataReader dr, String separator, IcaConfiguration configuration,
                                         String outputPrefix, String truthFilename) throws IOException {
        System.out.println("Filename: " + dr.getFilename() + "; " + configuration);

        long startTime = System.currentTimeMillis();
        IcaResult result = new NonNegativeIca(configuration).solve(dr.getData());
        double runTime = ((new Date()).getTime() - startTime) / 1000.0;
        System.out.println("Runtime: " + runTime);
        System.out.println("Iterations: " + result.getIterations() + " of " + configuration.getMaxIterations()
                + (result.isConverged() ? ", converged" : ", not converged"));

        if (outputPrefix != null) {
            DataReader.writeFile(result.getSources(), outputPrefix + "_sources.txt", separator);
            // one line per channel
            DataReader.writeFile(result.getMixingMatrix().transpose(), outputPrefix + "_mixing.txt", separator);
            System.out.println("Written: " + outputPrefix + "_sources.txt, " + outputPrefix + "_mixing.txt");
        }

        if (truthFilename != null) {
            DataReader truth = new DataReader(truthFilename, separator);
            truth.readFile();
            double[] correlations = Evaluator.matchedCorrelations(truth.getData(), result.getSources());
            DecimalFormat df = new DecimalFormat("0.000");
            for (int i = 0; i < correlations.length; i++) {
                System.out.println("Source " + i + " |correlation|: " + df.format(correlations[i]));
            }
        }
        return result;
    }

    static IcaConfiguration createConfiguration(CommandLine cmd, int channels) {
        Integer sources = cmd.hasOption("sources") ? Integer.valueOf(cmd.getOptionValue("sources")) : null;
        Double rate = cmd.hasOption("rate") ? Double.valueOf(cmd.getOptionValue("rate")) : null;
        Integer iterations = cmd.hasOption("iterations") ? Integer.valueOf(cmd.getOptionValue("iterations")) : null;
        Double tolerance = cmd.hasOption("tolerance") ? Double.valueOf(cmd.getOptionValue("tolerance")) : null;
        return IcaConfiguration.of(channels, sources, rate, iterations, tolerance);
    }

    static Options createOptions() {
        Options options = new Options();

        Option input = new Option("f", "filename", true, "input file path, one sample per line");
        input.setRequired(true);
        options.addOption(input);

        options.addOption(new Option("n", "sources", true, "number of sources (default: number of channels)"));
        options.addOption(new Option("r", "rate", true, "learning rate (default: " + IcaConfiguration.DEFAULT_LEARNING_RATE + ")"));
        options.addOption(new Option("i", "iterations", true, "maximum number of iterations (default: " + IcaConfiguration.DEFAULT_MAX_ITERATIONS + ")"));
        options.addOption(new Option("t", "tolerance", true, "tolerance on the W-change (default: " + IcaConfiguration.DEFAULT_TOLERANCE + ")"));
        options.addOption(new Option("s", "separator", true, "column separator (default: space)"));
        options.addOption(new Option("o", "output", true, "prefix of the output files"));
        options.addOption(new Option("g", "truth", true, "file with the true sources, for evaluation"));
        return options;
    }

    public static void main(String[] args) {

        String separator = " ";

        Options options = createOptions();
        CommandLineParser parser = new DefaultParser();
        HelpFormatter formatter = new HelpFormatter();
        CommandLine cmd = null;

        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            System.out.println(e.getMessage());
            formatter.printHelp("nnica", options);

            System.exit(1);
        }

        String inputFilePath = cmd.getOptionValue("filename");
        if (cmd.hasOption("separator")) {
            separator = cmd.getOptionValue("separator");
        }

        try {
            DataReader dr = new DataReader(inputFilePath, separator);
            dr.readFile();
            IcaConfiguration configuration = createConfiguration(cmd, dr.getChannels());
            separateFile(dr, separator, configuration, cmd.getOptionValue("output"), cmd.getOptionValue("truth"));
        } catch (IOException e) {
            System.err.println("Error reading or writing data: " + e.getMessage());
            System.exit(2);
        } catch (NumberFormatException | MathIllegalArgumentException e) {
            System.err.println("Invalid argument: " + e.getMessage());
            formatter.printHelp("nnica", options);
            System.exit(1);
        } catch (NumericalFailureException e) {
            System.err.println("Numerical failure: " + e.getMessage());
            System.exit(3);
        }
    }
}
