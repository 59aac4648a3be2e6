package com.tictactoehub.gameservice.games.tictactoe.interfaces.console;

import com.tictactoehub.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Cell;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.IllegalMoveException;
import com.tictactoehub.gameservice.games.tictactoe.service.TicTacToeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * 文本控制台：对局的展示层。
 * 把 "row col" 输入转成落子，每回合后打印棋盘；不含任何规则逻辑。
 * 命令：{@code row col}、{@code new}、{@code quit}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tictactoe.console", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConsoleGameRunner implements CommandLineRunner {

    static final String HELP = "Enter: <row> <col> | new | quit";
    static final String REJECTED = "Move not allowed, try another cell.";

    private final TicTacToeService service;

    @Override
    public void run(String... args) throws IOException {
        play(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    /**
     * 运行一次控制台会话，直到 "quit" 或输入结束。
     */
    public void play(BufferedReader in, PrintStream out) throws IOException {
        String gameId = service.newGame(null);
        out.println(GameMessages.READY);
        render(out, service.snapshot(gameId));
        out.println(HELP);
        try {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                if ("quit".equalsIgnoreCase(line)) break;
                if ("new".equalsIgnoreCase(line)) {
                    service.reset(gameId);
                    out.println(GameMessages.READY);
                    render(out, service.snapshot(gameId));
                    continue;
                }
                int[] rc = parse(line);
                if (rc == null) {
                    out.println(HELP);
                    continue;
                }
                try {
                    service.playAndRespond(gameId, rc[0], rc[1]);
                } catch (IllegalMoveException e) {
                    log.debug("控制台落子被忽略: {}", e.getMessage());
                    out.println(REJECTED);
                    continue;
                }
                render(out, service.snapshot(gameId));
            }
        } finally {
            service.closeGame(gameId);
        }
    }

    /** "1 2" 或 "1,2" -> {1, 2}；其他 -> null */
    static int[] parse(String line) {
        String[] parts = line.split("[\\s,]+");
        if (parts.length != 2) return null;
        try {
            return new int[]{Integer.parseInt(parts[0]), Integer.parseInt(parts[1])};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** 打印棋盘（获胜格加方括号）与状态行 */
    static void render(PrintStream out, GameSnapshot snap) {
        for (int r = 0; r < snap.boardSize; r++) {
            StringBuilder sb = new StringBuilder();
            for (int c = 0; c < snap.boardSize; c++) {
                boolean hit = snap.winningCells.contains(new Cell(r, c));
                sb.append(hit ? '[' : ' ').append(snap.cells[r][c]).append(hit ? ']' : ' ');
            }
            out.println(sb);
        }
        out.println(status(snap));
    }

    /** 状态文案：胜者 / 平局 / 轮到谁 */
    static String status(GameSnapshot snap) {
        if (snap.winner != null) return GameMessages.formatWon(String.valueOf(snap.winner));
        if (snap.sideToMove == null) return GameMessages.TIED;
        return GameMessages.formatTurn(String.valueOf(snap.sideToMove));
    }
}
