package vn.com.fecredit.videoupload.port.interfaces;

import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;

import java.nio.file.Path;

/**
 * Port to the durable catalog of finished uploads.
 */
public interface ICompletedUploadPort {

    /**
     * Records the finished artifact. Must be idempotent per session token: a repeated
     * call for the same session returns the id recorded the first time.
     *
     * @return the catalog id of the video
     */
    String recordCompletedUpload(IUploadSession session, Path artifact);
}
