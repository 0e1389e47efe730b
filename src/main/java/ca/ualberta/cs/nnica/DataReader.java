package ca.ualberta.cs.nnica;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.io.*;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Reads and writes delimited text matrices. A file holds one sample per line and one column
 * per channel; in memory the data is kept as channels x samples.
 */
public class DataReader {

    private String filename;
    private String separator;
    private RealMatrix data;

    public DataReader(String filename, String separator) {
        this.filename = filename;
        this.separator = separator;
    }

    public void readFile() throws IOException {
        List<double[]> samples = new ArrayList<>();
        int channels = -1;
        int lineNumber = 0;
        try (BufferedReader br = new BufferedReader(new FileReader(filename))) {
            String line = br.readLine();
            while (line != null) {
                lineNumber++;
                line = line.trim();
                if (!line.isEmpty() && !line.startsWith("#")) {
                    String[] parts = line.split(separator.trim().isEmpty() ? "\\s+" : Pattern.quote(separator));
                    if (channels < 0) {
                        channels = parts.length;
                    } else if (parts.length != channels) {
                        throw new IOException(filename + ":" + lineNumber + ": expected " + channels
                                + " columns, found " + parts.length);
                    }
                    double[] values = new double[parts.length];
                    for (int i = 0; i < parts.length; i++) {
                        try {
                            values[i] = Double.parseDouble(parts[i].trim());
                        } catch (NumberFormatException e) {
                            throw new IOException(filename + ":" + lineNumber + ": not a number: " + parts[i], e);
                        }
                    }
                    samples.add(values);
                }
                line = br.readLine();
            }
        }
        if (samples.isEmpty()) {
            throw new IOException(filename + ": no data");
        }

        double[][] transposed = new double[channels][samples.size()];
        for (int t = 0; t < samples.size(); t++) {
            double[] sample = samples.get(t);
            for (int c = 0; c < channels; c++) {
                transposed[c][t] = sample[c];
            }
        }
        data = MatrixUtils.createRealMatrix(transposed);
    }

    /**
     * Writes a rows x samples matrix with one sample per line, the layout {@link #readFile()} expects.
     */
    public static void writeFile(RealMatrix matrix, String filename, String separator) throws IOException {
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(filename))) {
            for (int t = 0; t < matrix.getColumnDimension(); t++) {
                StringBuilder line = new StringBuilder();
                for (int r = 0; r < matrix.getRowDimension(); r++) {
                    if (r > 0) {
                        line.append(separator);
                    }
                    line.append(matrix.getEntry(r, t));
                }
                writer.write(line.toString());
                writer.newLine();
            }
        }
    }

    public String getFilename() {
        return filename;
    }

    /**
     * @return channels x samples.
     */
    public RealMatrix getData() {
        return data;
    }

    public int getChannels() {
        return data.getRowDimension();
    }

    public int getSamples() {
        return data.getColumnDimension();
    }
}
