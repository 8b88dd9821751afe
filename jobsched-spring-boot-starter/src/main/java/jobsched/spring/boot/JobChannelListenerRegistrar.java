package jobsched.spring.boot;

import jobsched.JobListener;
import jobsched.registry.DefaultChannelRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link JobChannelListener} and registers them
 * in the {@link DefaultChannelRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 */
public class JobChannelListenerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultChannelRegistry registry;

    public JobChannelListenerRegistrar(ListableBeanFactory beanFactory, DefaultChannelRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(JobChannelListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof JobListener listener)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @JobChannelListener must implement JobListener, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // proxies may hide the annotation
            JobChannelListener annotation = AnnotationUtils.findAnnotation(bean.getClass(), JobChannelListener.class);
            if (annotation == null) {
                annotation = beanFactory.findAnnotationOnBean(beanName, JobChannelListener.class);
            }
            if (annotation == null || annotation.value().length == 0) {
                throw new BeanCreationException(beanName,
                        "@JobChannelListener on " + bean.getClass().getName() + " must name at least one channel");
            }

            for (String channel : annotation.value()) {
                if (channel.isBlank()) {
                    throw new BeanCreationException(beanName, "@JobChannelListener channel must not be blank");
                }
                registry.register(channel, listener);
            }
        }
    }
}
