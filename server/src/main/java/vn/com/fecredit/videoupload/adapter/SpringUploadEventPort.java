package vn.com.fecredit.videoupload.adapter;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import vn.com.fecredit.videoupload.model.UploadCompletedEvent;
import vn.com.fecredit.videoupload.port.interfaces.IUploadEventPort;

/**
 * Publishes completion events on the Spring application event bus.
 */
@Component
public class SpringUploadEventPort implements IUploadEventPort {

    private final ApplicationEventPublisher publisher;

    public SpringUploadEventPort(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void publishUploadCompleted(UploadCompletedEvent event) {
        publisher.publishEvent(event);
    }
}
