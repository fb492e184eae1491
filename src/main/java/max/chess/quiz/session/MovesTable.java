package max.chess.quiz.session;

import java.util.ArrayList;
import java.util.List;

/** The moves between the preview and the scored position, laid out in White / Black rows. */
public final class MovesTable {

    public record Row(String white, String black) {
    }

    private MovesTable() {
    }

    /**
     * @param moves           SAN of the listed half-moves
     * @param blackMovesFirst the first listed move is Black's, it then opens a row with an empty White cell
     */
    public static List<Row> of(List<String> moves, boolean blackMovesFirst) {
        List<Row> rows = new ArrayList<>();
        int i = 0;
        if(blackMovesFirst && !moves.isEmpty()) {
            rows.add(new Row("", moves.get(0)));
            i = 1;
        }
        for(; i < moves.size(); i += 2) {
            String black = i + 1 < moves.size() ? moves.get(i + 1) : "";
            rows.add(new Row(moves.get(i), black));
        }
        return rows;
    }

    public static String render(List<Row> rows) {
        StringBuilder sb = new StringBuilder(String.format("%-10s%s%n", "White", "Black"));
        for(Row row : rows) {
            sb.append(String.format("%-10s%s%n", row.white(), row.black()));
        }
        return sb.toString();
    }
}
