package com.rom.ei;

import com.rom.ei.algorithms.GreedyResult;
import com.rom.ei.api.Operator;
import com.rom.ei.api.Parameter;
import com.rom.ei.api.VectorArray;
import com.rom.ei.interpolation.InterpolationResult;
import com.rom.ei.interpolation.OperatorInterpolation;
import com.rom.ei.io.InterpolationSettings;
import com.rom.ei.io.ResultReportWriter;
import com.rom.ei.io.SettingsLoader;
import com.rom.ei.la.DenseVectorArray;
import com.rom.ei.model.GenericDiscretization;
import com.rom.ei.operators.FunctionOperator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Interpolates the nonlinear reaction term {@code r(u) = exp(mu * u)} of a
 * 1D model whose snapshots are {@code u(x; mu) = sin(pi x) / (1 + mu x)}.
 *
 * Usage: {@code EiDemo [settings.json]}; without an argument the bundled
 * {@code ei-demo.json} is used.
 */
@Log4j2
public class EiDemo {
    static final int GRID = 200;

    public static void main(String[] args) throws Exception {
        InterpolationSettings settings = args.length > 0
                ? SettingsLoader.load(Path.of(args[0]))
                : SettingsLoader.loadResource("ei-demo.json");
        log.info("Settings: {}", settings);

        GenericDiscretization model = model();
        List<Parameter> training = sample(0.1, 5.0, 25);

        InterpolationResult result = OperatorInterpolation.run(model, List.of("reaction"), training, settings);
        log.info("Selected DOFs: {}", Arrays.toString(result.dofs()));
        log.info("Report:\n{}", new ResultReportWriter().toJson(
                new GreedyResult(result.dofs(), result.basis(), result.history())));

        // validate on parameters not seen during training
        Operator full = model.operator("reaction");
        Operator interpolated = result.discretization().operators().get("reaction");
        double worst = 0.0;
        for (Parameter mu : sample(0.15, 4.9, 17)) {
            VectorArray u = model.solve(mu);
            VectorArray err = full.apply(u, mu);
            err.subtract(interpolated.apply(u, mu));
            worst = Math.max(worst, err.l2Norm()[0]);
        }
        log.info("Worst validation error: {}", worst);
    }

    static GenericDiscretization model() {
        Operator reaction = new FunctionOperator(GRID, GRID, (u, mu, out) -> {
            double m = mu.get("mu");
            for (int i = 0; i < u.length; i++)
                out[i] = Math.exp(m * u[i]);
        });
        return new GenericDiscretization("reaction_1d", mu -> {
            double m = mu.get("mu");
            double[] u = new double[GRID];
            for (int i = 0; i < GRID; i++) {
                double x = (i + 0.5) / GRID;
                u[i] = Math.sin(Math.PI * x) / (1.0 + m * x);
            }
            return DenseVectorArray.of(u);
        }, Map.of("reaction", reaction));
    }

    static List<Parameter> sample(double from, double to, int count) {
        List<Parameter> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++)
            out.add(Parameter.of("mu", from + (to - from) * i / (count - 1)));
        return out;
    }
}
