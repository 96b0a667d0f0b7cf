package org.learningjava.pyml.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pyml")
public class PymlProperties {
    private String blockStyle = "colon-indent";
    private String indentationUnit = "  ";
    private int sourceIndentWidth = 2;
    private boolean keepComments = false;

    public String getBlockStyle() { return blockStyle; }
    public void setBlockStyle(String v) { this.blockStyle = v; }
    public String getIndentationUnit() { return indentationUnit; }
    public void setIndentationUnit(String v) { this.indentationUnit = v; }
    public int getSourceIndentWidth() { return sourceIndentWidth; }
    public void setSourceIndentWidth(int v) { this.sourceIndentWidth = v; }
    public boolean isKeepComments() { return keepComments; }
    public void setKeepComments(boolean v) { this.keepComments = v; }
}
