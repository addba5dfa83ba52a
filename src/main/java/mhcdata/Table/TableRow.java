package mhcdata.Table;

public class TableRow {

    public final int lineNum; // 1-based line of the file where the row starts
    private final String[] cellArray;

    public TableRow(int lineNum, String[] cellArray) {
        this.lineNum = lineNum;
        this.cellArray = cellArray;
    }

    String getCell(int idx) {
        if (idx >= cellArray.length) {
            return null;
        }
        return cellArray[idx];
    }

    public int getCellNum() {
        return cellArray.length;
    }
}
