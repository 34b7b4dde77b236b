package vn.com.fecredit.videoupload.port.interfaces;

import vn.com.fecredit.videoupload.model.UploadCompletedEvent;

/**
 * Port to the analysis dispatcher. Called once per completed session.
 */
public interface IUploadEventPort {
    void publishUploadCompleted(UploadCompletedEvent event);
}
