package net.chapterone.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Reward points per action type before time decay. Ratings use the rating value itself.
 */
@Component
@ConfigurationProperties(prefix = "app.reward.points")
public class RewardPointProperties {

    private double click = 1.0;
    private double save = 3.0;
    private double unsave = -3.0;
    private double dismiss = -0.5;
    private double share = 2.0;

    /**
     * Points for a view whose dwell time reaches {@link #engagedViewMillis}; shorter views score 0.
     */
    private double engagedView = 0.5;

    private long engagedViewMillis = 2000;

    public double getClick() {
        return click;
    }

    public void setClick(double click) {
        this.click = click;
    }

    public double getSave() {
        return save;
    }

    public void setSave(double save) {
        this.save = save;
    }

    public double getUnsave() {
        return unsave;
    }

    public void setUnsave(double unsave) {
        this.unsave = unsave;
    }

    public double getDismiss() {
        return dismiss;
    }

    public void setDismiss(double dismiss) {
        this.dismiss = dismiss;
    }

    public double getShare() {
        return share;
    }

    public void setShare(double share) {
        this.share = share;
    }

    public double getEngagedView() {
        return engagedView;
    }

    public void setEngagedView(double engagedView) {
        this.engagedView = engagedView;
    }

    public long getEngagedViewMillis() {
        return engagedViewMillis;
    }

    public void setEngagedViewMillis(long engagedViewMillis) {
        this.engagedViewMillis = engagedViewMillis;
    }
}
