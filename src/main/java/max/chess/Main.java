package max.chess;

import max.chess.quiz.console.QuizConsole;
import max.chess.quiz.corpus.CorpusException;
import max.chess.quiz.corpus.CorpusLoader;
import max.chess.quiz.corpus.PositionCorpus;
import max.chess.quiz.puzzle.AnswerEngine;
import max.chess.quiz.puzzle.GameReconstructor;
import max.chess.quiz.puzzle.PositionSampler;
import max.chess.quiz.puzzle.PuzzleLoader;
import max.chess.quiz.session.ExecutorTickScheduler;
import max.chess.quiz.session.PuzzleLoaderFactory;
import max.chess.quiz.session.QuizConfig;
import max.chess.quiz.session.QuizSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.random.RandomGenerator;

public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        QuizConfig config;
        try {
            config = QuizConfig.load(args.length > 0 ? args[0] : null);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.error("Invalid configuration", e);
            System.exit(2);
            return;
        }

        RandomGenerator random = RandomGenerator.getDefault();
        PuzzleLoaderFactory loaderFactory = settings -> {
            PositionCorpus corpus = new CorpusLoader().load(settings.gamesLocation, settings.weightsLocation);
            return new PuzzleLoader(corpus, new PositionSampler(random), new GameReconstructor(corpus), new AnswerEngine());
        };
        try(ExecutorTickScheduler scheduler = new ExecutorTickScheduler()) {
            QuizSession session;
            try {
                session = new QuizSession(config, loaderFactory, scheduler, random);
            } catch (CorpusException e) {
                LOGGER.error("Cannot load the corpus", e);
                System.exit(1);
                return;
            }
            PrintWriter out = new PrintWriter(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)), true);
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new QuizConsole(session, in, out).run();
        }
    }
}
