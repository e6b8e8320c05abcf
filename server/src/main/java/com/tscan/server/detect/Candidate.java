package com.tscan.server.detect;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A transient candidate inside one triplet. Coordinates are relative to the
 * group's crop rectangle.
 * <p>
 * aiScore, verdict and saved are optional and stay null until the classifier
 * or a human fills them in.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Candidate {

    private int id;
    private int x;
    private int y;
    private double area;
    private double sharp;
    private double contrast;
    private double peak;
    private double rise;

    @JsonProperty("val_b")
    private double valB;

    @JsonProperty("val_c")
    private double valC;

    @JsonProperty("cheap_score")
    private double cheapScore;

    @JsonProperty("ai_score")
    private Double aiScore;

    private boolean manual;
    private Verdict verdict;
    private Boolean saved;

    public Candidate() {
    }

    public Candidate(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public static Candidate manual(int x, int y, Verdict verdict) {
        Candidate c = new Candidate(x, y);
        c.manual = true;
        c.verdict = verdict;
        c.saved = verdict != null ? Boolean.TRUE : null;
        return c;
    }

    public Candidate copy() {
        Candidate c = new Candidate(x, y);
        c.id = id;
        c.area = area;
        c.sharp = sharp;
        c.contrast = contrast;
        c.peak = peak;
        c.rise = rise;
        c.valB = valB;
        c.valC = valC;
        c.cheapScore = cheapScore;
        c.aiScore = aiScore;
        c.manual = manual;
        c.verdict = verdict;
        c.saved = saved;
        return c;
    }

    /**
     * True when a human touched this candidate, either by adding it or by
     * recording a real/bogus verdict. Such entries must survive recompute.
     */
    @JsonIgnore
    public boolean isHumanCurated() {
        return manual || hasVerdict();
    }

    @JsonIgnore
    public boolean hasVerdict() {
        return verdict != null && verdict != Verdict.UNKNOWN;
    }

    @JsonIgnore
    public boolean hasAiScore() {
        return aiScore != null;
    }

    public boolean isNear(Candidate other, int radius) {
        return Math.abs(x - other.x) <= radius && Math.abs(y - other.y) <= radius;
    }

    public int getId() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
    }

    public int getX() {
        return x;
    }

    public void setX(int x) {
        this.x = x;
    }

    public int getY() {
        return y;
    }

    public void setY(int y) {
        this.y = y;
    }

    public double getArea() {
        return area;
    }

    public void setArea(double area) {
        this.area = area;
    }

    public double getSharp() {
        return sharp;
    }

    public void setSharp(double sharp) {
        this.sharp = sharp;
    }

    public double getContrast() {
        return contrast;
    }

    public void setContrast(double contrast) {
        this.contrast = contrast;
    }

    public double getPeak() {
        return peak;
    }

    public void setPeak(double peak) {
        this.peak = peak;
    }

    public double getRise() {
        return rise;
    }

    public void setRise(double rise) {
        this.rise = rise;
    }

    public double getValB() {
        return valB;
    }

    public void setValB(double valB) {
        this.valB = valB;
    }

    public double getValC() {
        return valC;
    }

    public void setValC(double valC) {
        this.valC = valC;
    }

    public double getCheapScore() {
        return cheapScore;
    }

    public void setCheapScore(double cheapScore) {
        this.cheapScore = cheapScore;
    }

    public Double getAiScore() {
        return aiScore;
    }

    public void setAiScore(Double aiScore) {
        this.aiScore = aiScore;
    }

    public boolean isManual() {
        return manual;
    }

    public void setManual(boolean manual) {
        this.manual = manual;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public void setVerdict(Verdict verdict) {
        this.verdict = verdict;
    }

    public Boolean getSaved() {
        return saved;
    }

    public void setSaved(Boolean saved) {
        this.saved = saved;
    }

    @Override
    public String toString() {
        return "Candidate{id=" + id + ", x=" + x + ", y=" + y + ", rise=" + rise
                + ", ai=" + aiScore + ", manual=" + manual + ", verdict=" + verdict + "}";
    }
}
