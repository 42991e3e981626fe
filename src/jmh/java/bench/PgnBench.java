package bench;

import chessdoc.contracts.Node;
import chessdoc.game.Game;
import chessdoc.impl.PgnReaderImpl;
import chessdoc.impl.PgnWriterImpl;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/** Micro-benchmark: PGN decoding and encoding of a long annotated game */
@BenchmarkMode(Mode.Throughput)            // games per millisecond
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 5,  time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Fork(2)
public class PgnBench {

    @State(Scope.Thread)
    public static class TestData {
        final PgnReaderImpl reader = new PgnReaderImpl();
        final PgnWriterImpl writer = new PgnWriterImpl();
        Game game;
        String pgn;

        @Setup(Level.Trial)
        public void init() {
            // knights going back and forth, with a commented sideline every cycle
            game = new Game();
            Node node = game.mainVariation().play("Nf3");
            for (int i = 0; i < 40; i++) {
                node.addNag(1);
                node.addVariation().play("e4").setComment("Sideline " + i);
                node = node.play("Nf6").play("Ng1").play("Ng8").play("Nf3");
            }
            pgn = writer.write(game);
        }
    }

    @Benchmark
    public Game read(TestData td) {
        return td.reader.readGame(td.pgn);
    }

    @Benchmark
    public String write(TestData td) {
        return td.writer.write(td.game);
    }

    @Benchmark
    public int countGames(TestData td) {
        return td.reader.readDatabase(td.pgn).gameCount();
    }
}
