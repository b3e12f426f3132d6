package me.christianrobert.arclabel.transformer.parser;

/**
 * Statement kinds of the VBScript label surface.
 */
public enum LineType {
    FUNCTION_HEADER("Function"),
    FUNCTION_END("End Function"),
    ASSIGNMENT("assignment"),
    DECLARATION("Dim"),
    IF_HEADER("If"),
    ELSE_IF_HEADER("ElseIf"),
    ELSE_HEADER("Else"),
    END_IF("End If"),
    SELECT_CASE_HEADER("Select Case"),
    CASE_HEADER("Case"),
    CASE_ELSE_HEADER("Case Else"),
    END_SELECT("End Select");

    private final String keyword;

    LineType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Source keyword, used in error messages.
     */
    public String getKeyword() {
        return keyword;
    }
}
