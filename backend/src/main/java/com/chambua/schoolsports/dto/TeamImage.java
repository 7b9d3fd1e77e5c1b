package com.chambua.schoolsports.dto;

/**
 * One entry of the team-image metadata file. {@code id} is the creation time in epoch millis, as text.
 */
public class TeamImage {
    private String id;
    private String imageUrl;
    private String teamName;
    private String sport;
    private String filename;

    public TeamImage() {}

    public TeamImage(String id, String imageUrl, String teamName, String sport, String filename) {
        this.id = id;
        this.imageUrl = imageUrl;
        this.teamName = teamName;
        this.sport = sport;
        this.filename = filename;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getImageUrl() { return imageUrl; }
    public void setImageUrl(String imageUrl) { this.imageUrl = imageUrl; }
    public String getTeamName() { return teamName; }
    public void setTeamName(String teamName) { this.teamName = teamName; }
    public String getSport() { return sport; }
    public void setSport(String sport) { this.sport = sport; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
}
