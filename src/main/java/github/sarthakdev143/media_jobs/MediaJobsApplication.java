package github.sarthakdev143.media_jobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MediaJobsApplication {

	public static void main(String[] args) {
		SpringApplication.run(MediaJobsApplication.class, args);
		System.out.println("					                                  \r\n" + //
				"                     .___.__                  __        ___.            \r\n" + //
				"  _____   ____   __| _/|__|____              |__| ____\\_ |__   ______\r\n" + //
				" /     \\_/ __ \\ / __ | |  \\__  \\   ______    |  |/  _ \\| __ \\ /  ___/\r\n" + //
				"|  Y Y  \\  ___// /_/ | |  |/ __ \\_/_____/    |  (  <_> ) \\_\\ \\\\___ \\ \r\n" + //
				"|__|_|  /\\___  >____ | |__(____  /       /\\__|  |\\____/|___  /____  >\r\n" + //
				"      \\/     \\/     \\/         \\/        \\______|          \\/     \\/ ");
	}

}
